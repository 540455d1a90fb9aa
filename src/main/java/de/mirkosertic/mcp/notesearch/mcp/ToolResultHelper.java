package de.mirkosertic.mcp.notesearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * Wraps response DTOs into MCP tool results.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Serializes the response to JSON text content. Responses with {@code success=false} are flagged as
     * errors.
     */
    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        final String json = "{\"success\":false,\"error\":\"" + escapeJson(errorMessage) + "\"}";
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(json)))
                .isError(true)
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            logger.error("Failed to serialize {}", obj.getClass().getSimpleName(), e);
            return "{\"success\":false,\"error\":\"JSON serialization error: " + escapeJson(e.getMessage()) + "\"}";
        }
    }

    static boolean isErrorResponse(final Object response) {
        if (!(response instanceof Record record)) {
            return false;
        }
        for (final RecordComponent component : record.getClass().getRecordComponents()) {
            if ("success".equals(component.getName())) {
                try {
                    return component.getAccessor().invoke(record) instanceof Boolean success && !success;
                } catch (final IllegalAccessException | InvocationTargetException e) {
                    logger.debug("Cannot read success flag of {}", record.getClass().getSimpleName(), e);
                    return false;
                }
            }
        }
        return false;
    }

    static String escapeJson(final String str) {
        if (str == null) {
            return "";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
