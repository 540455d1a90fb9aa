package de.mirkosertic.mcp.notesearch.scoring;

import de.mirkosertic.mcp.notesearch.NoteTextAnalyzer;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Extracts the distinct content keywords of a text using {@link NoteTextAnalyzer}.
 *
 * <p>Keywords are folded, stop word free tokens of at least {@link #MIN_KEYWORD_LENGTH} characters, in
 * order of first occurrence. Thread-safe; the analyzer reuses token streams per thread.</p>
 */
public class KeywordExtractor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(KeywordExtractor.class);

    public static final int MIN_KEYWORD_LENGTH = 3;

    private static final String FIELD_NAME = "content";

    private final Analyzer analyzer;

    public KeywordExtractor() {
        this(new NoteTextAnalyzer());
    }

    public KeywordExtractor(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Set<String> extractKeywords(final @Nullable String text) {
        final Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return keywords;
        }

        try (final TokenStream stream = analyzer.tokenStream(FIELD_NAME, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                if (term.length() >= MIN_KEYWORD_LENGTH) {
                    keywords.add(term.toString());
                }
            }
            stream.end();
        } catch (final IOException e) {
            // in-memory input, only a broken analyzer chain gets here
            logger.error("Failed to analyze text of length {}", text.length(), e);
            throw new UncheckedIOException(e);
        }
        return keywords;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
