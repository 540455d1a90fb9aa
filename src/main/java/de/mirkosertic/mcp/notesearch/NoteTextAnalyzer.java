package de.mirkosertic.mcp.notesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer for note bodies, used to extract keywords.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> StopFilter(English)}</p>
 *
 * <p>Folding runs before stop word removal, so {@code "The"} and {@code "ＴＨＥ"} are both dropped and
 * {@code "Müller"} yields the same token as {@code "muller"}. No stemming is applied.</p>
 */
public class NoteTextAnalyzer extends Analyzer {

    private final CharArraySet stopWords;

    public NoteTextAnalyzer() {
        this(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
    }

    public NoteTextAnalyzer(final CharArraySet stopWords) {
        this.stopWords = stopWords;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        stream = new StopFilter(stream, stopWords);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
