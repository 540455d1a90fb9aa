package de.mirkosertic.mcp.notesearch.util;

import java.util.regex.Pattern;

/**
 * Removes characters from note text that would disturb frontmatter parsing, matching and snippets.
 *
 * <p>Markdown is line oriented, so line breaks are kept. Removed are:</p>
 * <ul>
 *   <li>a leading byte order mark and any other U+FEFF</li>
 *   <li>zero-width space, non-joiner and joiner</li>
 *   <li>the replacement character U+FFFD left by failed decoding</li>
 *   <li>control characters other than tab and line breaks</li>
 * </ul>
 * <p>{@code \r\n} and lone {@code \r} line endings become {@code \n}.</p>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +             // NULL and control chars before TAB
        "\u000B-\u000C" +             // VT, FF
        "\u000E-\u001F" +             // Control chars after CR
        "\u007F" +                    // DEL
        "\u200B-\u200D" +             // Zero-width space, non-joiner, joiner
        "\uFEFF" +                    // Byte order mark
        "\uFFFD" +                    // Replacement character
        "]"
    );

    private static final Pattern LINE_ENDINGS = Pattern.compile("\r\n?");

    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \t]+$", Pattern.MULTILINE);

    private TextCleaner() {
    }

    /**
     * Cleans a whole markdown file, keeping its line structure.
     *
     * @return cleaned text, {@code ""} for null input
     */
    public static String cleanMarkdown(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = LINE_ENDINGS.matcher(text).replaceAll("\n");
        cleaned = INVALID_CHARS.matcher(cleaned).replaceAll("");
        return TRAILING_SPACES.matcher(cleaned).replaceAll("");
    }

    /**
     * Cleans a single line value such as a title or tag: invalid characters are removed, whitespace runs
     * collapse to one space and the result is trimmed.
     *
     * @return cleaned value, {@code ""} for null input
     */
    public static String cleanValue(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String cleaned = INVALID_CHARS.matcher(text).replaceAll("");
        return cleaned.replaceAll("\\s+", " ").trim();
    }
}
