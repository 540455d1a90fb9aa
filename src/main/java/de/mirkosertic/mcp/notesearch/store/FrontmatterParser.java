package de.mirkosertic.mcp.notesearch.store;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits a markdown file into YAML frontmatter and body.
 *
 * <p>Frontmatter is recognized only when the first line is {@code ---}. It ends at the next line consisting of
 * {@code ---}; without such a line the file is treated as having no frontmatter. Expects {@code \n} line
 * endings, see {@link de.mirkosertic.mcp.notesearch.util.TextCleaner#cleanMarkdown(String)}.</p>
 */
public class FrontmatterParser {

    static final String DELIMITER = "---";
    static final int MAX_FRONTMATTER_LENGTH = 1024 * 1024;

    private final LoaderOptions loaderOptions;

    public FrontmatterParser() {
        this.loaderOptions = new LoaderOptions();
        this.loaderOptions.setAllowDuplicateKeys(false);
        this.loaderOptions.setMaxAliasesForCollections(20);
    }

    /**
     * @param path used in error messages only
     * @throws DocumentParseException if the frontmatter is not valid YAML, holds an unconvertible value, is not a
     *                                mapping or is too large
     */
    public Frontmatter parse(final String path, final String text) throws DocumentParseException {
        if (!text.startsWith(DELIMITER)) {
            return new Frontmatter(Map.of(), text);
        }
        final int firstLineEnd = text.indexOf('\n');
        if (firstLineEnd < 0 || !text.substring(0, firstLineEnd).trim().equals(DELIMITER)) {
            return new Frontmatter(Map.of(), text);
        }

        int lineStart = firstLineEnd + 1;
        int closingStart = -1;
        int bodyStart = text.length();
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            if (text.substring(lineStart, lineEnd).trim().equals(DELIMITER)) {
                closingStart = lineStart;
                bodyStart = Math.min(text.length(), lineEnd + 1);
                break;
            }
            lineStart = lineEnd + 1;
        }
        if (closingStart < 0) {
            return new Frontmatter(Map.of(), text);
        }

        final String yamlText = text.substring(firstLineEnd + 1, closingStart);
        if (yamlText.length() > MAX_FRONTMATTER_LENGTH) {
            throw new DocumentParseException(path, "Frontmatter exceeds " + MAX_FRONTMATTER_LENGTH + " characters");
        }

        final Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(loaderOptions)).load(yamlText);
        } catch (final YAMLException e) {
            throw new DocumentParseException(path, "Invalid frontmatter: " + e.getMessage(), e);
        } catch (final RuntimeException e) {
            // tagged scalars such as "!!int abc" fail with a plain NumberFormatException
            throw new DocumentParseException(path, "Invalid frontmatter value: " + e.getMessage(), e);
        }

        final String body = text.substring(bodyStart);
        if (loaded == null) {
            return new Frontmatter(Map.of(), body);
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new DocumentParseException(path, "Frontmatter must be a mapping");
        }
        final Map<String, Object> properties = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            properties.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return new Frontmatter(properties, body);
    }
}
