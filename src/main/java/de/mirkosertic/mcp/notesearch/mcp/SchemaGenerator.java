package de.mirkosertic.mcp.notesearch.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates JSON Schema from request records for MCP tool definitions.
 * <p>
 * Components annotated with {@link Nullable} are optional, all others are required. Enums are offered by
 * their lowercase names, which is what the request parsers accept.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    /**
     * @param recordClass the request record
     * @return a JsonSchema suitable for MCP tool inputSchema
     */
    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), generatePropertySchema(component.getGenericType(), component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema of tools that take no parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static boolean isNullable(final RecordComponent component) {
        // type-use annotations land on the annotated type, declaration annotations on the component
        return component.isAnnotationPresent(Nullable.class)
                || component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> generatePropertySchema(final Type type, final AnnotatedElement element) {
        final Map<String, Object> schema = new LinkedHashMap<>();

        final Description description = element.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        if (type instanceof Class<?> clazz) {
            addTypeSchema(schema, clazz);
        } else if (type instanceof ParameterizedType paramType) {
            addParameterizedTypeSchema(schema, paramType);
        } else {
            schema.put("type", "string");
        }

        return schema;
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Class<?> clazz) {
        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> enumValues = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                enumValues.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("enum", enumValues);
        } else if (clazz.isRecord()) {
            schema.put("type", "object");
            final Map<String, Object> nestedProperties = new LinkedHashMap<>();
            final List<String> nestedRequired = new ArrayList<>();
            for (final RecordComponent component : clazz.getRecordComponents()) {
                nestedProperties.put(component.getName(),
                        generatePropertySchema(component.getGenericType(), component));
                if (!isNullable(component)) {
                    nestedRequired.add(component.getName());
                }
            }
            schema.put("properties", nestedProperties);
            if (!nestedRequired.isEmpty()) {
                schema.put("required", nestedRequired);
            }
        } else {
            schema.put("type", "object");
        }
    }

    private static void addParameterizedTypeSchema(final Map<String, Object> schema,
                                                   final ParameterizedType paramType) {
        if (paramType.getRawType() instanceof Class<?> rawClass && Collection.class.isAssignableFrom(rawClass)) {
            schema.put("type", "array");
            final Type[] typeArgs = paramType.getActualTypeArguments();
            if (typeArgs.length > 0) {
                final Map<String, Object> itemSchema = new LinkedHashMap<>();
                if (typeArgs[0] instanceof Class<?> itemClass) {
                    addTypeSchema(itemSchema, itemClass);
                } else {
                    itemSchema.put("type", "object");
                }
                schema.put("items", itemSchema);
            }
        } else if (paramType.getRawType() instanceof Class<?> rawClass && Map.class.isAssignableFrom(rawClass)) {
            schema.put("type", "object");
            schema.put("additionalProperties", true);
        } else {
            schema.put("type", "object");
        }
    }
}
