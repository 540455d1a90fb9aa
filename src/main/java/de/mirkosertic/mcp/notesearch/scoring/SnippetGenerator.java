package de.mirkosertic.mcp.notesearch.scoring;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a short excerpt around the first occurrence of a term.
 *
 * <p>The excerpt consists of whole words: the words holding the match plus up to {@code contextWords}
 * words on each side. Words are dropped from the side farther away from the match until the excerpt fits
 * {@code maxLength}. The match is wrapped in {@code **} and cut edges are marked with {@code ...}.
 * Whitespace runs are collapsed to single spaces.</p>
 */
public final class SnippetGenerator {

    public static final int DEFAULT_MAX_LENGTH = 150;
    public static final int DEFAULT_CONTEXT_WORDS = 5;

    static final String ELLIPSIS = "...";
    static final String HIGHLIGHT = "**";

    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SnippetGenerator() {
    }

    /**
     * @param content      document body
     * @param term         literal search term, matched case-insensitively
     * @param maxLength    maximum excerpt length without highlight markers and ellipses
     * @param contextWords words to keep on each side of the match
     * @return the excerpt, the beginning of the content if the term does not occur, or {@code ""} for empty content
     */
    public static String generate(final @Nullable String content, final @Nullable String term,
                                  final int maxLength, final int contextWords) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        final int length = maxLength > 0 ? maxLength : DEFAULT_MAX_LENGTH;
        final int context = Math.max(0, contextWords);
        final String needle = term != null ? term.trim() : "";

        final int matchStart = needle.isEmpty() ? -1 : indexOfIgnoreCase(content, needle);
        if (matchStart < 0) {
            if (content.length() <= length) {
                return collapse(content).trim();
            }
            return collapse(content.substring(0, length)).trim() + ELLIPSIS;
        }
        final int matchEnd = matchStart + needle.length();

        final List<int[]> words = new ArrayList<>();
        final Matcher matcher = WORD.matcher(content);
        while (matcher.find()) {
            words.add(new int[]{matcher.start(), matcher.end()});
        }
        final int firstMatchWord = wordIndexAt(words, matchStart);
        final int lastMatchWord = wordIndexAt(words, matchEnd - 1);

        int first = Math.max(0, firstMatchWord - context);
        int last = Math.min(words.size() - 1, lastMatchWord + context);
        int start = words.get(first)[0];
        int end = words.get(last)[1];

        while (end - start > length && (first < firstMatchWord || last > lastMatchWord)) {
            final boolean dropRight = last > lastMatchWord
                    && (first == firstMatchWord || end - matchEnd >= matchStart - start);
            if (dropRight) {
                last--;
            } else {
                first++;
            }
            start = words.get(first)[0];
            end = words.get(last)[1];
        }

        if (end - start > length) {
            // the words around the match alone are too long, cut characters around it
            final int room = Math.max(0, length - needle.length());
            start = Math.max(start, matchStart - room / 2);
            end = Math.max(matchEnd, Math.min(end, start + Math.max(length, needle.length())));
        }

        final StringBuilder snippet = new StringBuilder();
        if (start > 0 && !content.substring(0, start).isBlank()) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(collapse(content.substring(start, matchStart)))
                .append(HIGHLIGHT)
                .append(collapse(content.substring(matchStart, matchEnd)))
                .append(HIGHLIGHT)
                .append(collapse(content.substring(matchEnd, end)));
        if (end < content.length() && !content.substring(end).isBlank()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }

    private static int wordIndexAt(final List<int[]> words, final int offset) {
        for (int i = 0; i < words.size(); i++) {
            if (offset < words.get(i)[1]) {
                return i;
            }
        }
        return words.size() - 1;
    }

    private static int indexOfIgnoreCase(final String haystack, final String needle) {
        final int limit = haystack.length() - needle.length();
        for (int i = 0; i <= limit; i++) {
            if (haystack.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static String collapse(final String text) {
        return WHITESPACE.matcher(text).replaceAll(" ");
    }
}
