package de.mirkosertic.mcp.notesearch.suggest;

import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatch;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatcher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Query completion and spelling correction over the indexed titles, tags and content phrases.
 *
 * <p>Three prefix tries are built from the documents:</p>
 * <ul>
 *   <li>titles: every title word longer than two characters, plus every multi-word title</li>
 *   <li>tags: every tag, lowercase</li>
 *   <li>phrases: runs of 2 to 4 consecutive content words longer than two characters within one sentence,
 *       between 6 and 49 characters long</li>
 * </ul>
 *
 * <p>Instances are immutable after construction and can be shared between threads.</p>
 */
public class SearchSuggester {

    private static final Logger logger = LoggerFactory.getLogger(SearchSuggester.class);

    static final double CORRECTION_MIN_SIMILARITY = 0.7;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final int MIN_WORD_LENGTH = 3;
    private static final int MIN_PHRASE_WORDS = 2;
    private static final int MAX_PHRASE_WORDS = 4;
    private static final int MIN_PHRASE_LENGTH = 6;
    private static final int MAX_PHRASE_LENGTH = 49;

    private final FuzzyMatcher fuzzyMatcher;
    private final TrieNode titleTrie = new TrieNode();
    private final TrieNode tagTrie = new TrieNode();
    private final TrieNode phraseTrie = new TrieNode();

    public SearchSuggester(final Collection<IndexedDocument> documents, final FuzzyMatcher fuzzyMatcher) {
        this.fuzzyMatcher = fuzzyMatcher;

        int documentId = 0;
        for (final IndexedDocument document : documents) {
            documentId++;
            indexTitle(document.title(), documentId);
            for (final String tag : document.tags()) {
                tagTrie.insert(tag.toLowerCase(Locale.ROOT), documentId);
            }
            indexPhrases(document.content(), documentId);
        }
        logger.debug("Built suggestion tries from {} documents", documentId);
    }

    public List<Suggestion> getSuggestions(final String prefix, final int maxSuggestions) {
        return getSuggestions(prefix, maxSuggestions, true);
    }

    /**
     * Completions of {@code prefix} from all three tries, each contributing at most a third of
     * {@code maxSuggestions}. Spelling corrections are added while fewer than half of {@code maxSuggestions}
     * completions were found.
     *
     * @return suggestions by descending score, at most {@code maxSuggestions}
     */
    public List<Suggestion> getSuggestions(final String prefix, final int maxSuggestions,
                                           final boolean includeCorrections) {
        final String normalized = prefix == null ? "" : prefix.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || maxSuggestions <= 0) {
            return List.of();
        }

        final int perTrie = (int) Math.ceil(maxSuggestions / 3.0);
        final List<Suggestion> suggestions = new ArrayList<>();
        suggestions.addAll(completions(titleTrie, normalized, SuggestionType.TITLE, perTrie));
        suggestions.addAll(completions(tagTrie, normalized, SuggestionType.TAG, perTrie));
        suggestions.addAll(completions(phraseTrie, normalized, SuggestionType.PHRASE, perTrie));

        if (includeCorrections && suggestions.size() < maxSuggestions / 2.0) {
            suggestions.addAll(corrections(normalized, maxSuggestions - suggestions.size()));
        }

        suggestions.sort(Comparator.comparingInt(Suggestion::score).reversed());
        return suggestions.size() > maxSuggestions ? List.copyOf(suggestions.subList(0, maxSuggestions)) : suggestions;
    }

    /**
     * The most frequent title words (frequency times 10) and tags (frequency times 15).
     */
    public List<Suggestion> getPopularSearches(final int limit) {
        if (limit <= 0) {
            return List.of();
        }
        final List<Suggestion> popular = new ArrayList<>();
        for (final TrieNode node : titleTrie.terminals()) {
            popular.add(new Suggestion(node.value, SuggestionType.TITLE, node.frequency * 10, node.documentCount));
        }
        for (final TrieNode node : tagTrie.terminals()) {
            popular.add(new Suggestion(node.value, SuggestionType.TAG, node.frequency * 15, node.documentCount));
        }
        popular.sort(Comparator.comparingInt(Suggestion::score).reversed());
        return popular.size() > limit ? List.copyOf(popular.subList(0, limit)) : popular;
    }

    private void indexTitle(final String title, final int documentId) {
        final String normalized = title.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return;
        }
        final String[] words = WHITESPACE.split(normalized);
        for (final String word : words) {
            if (word.length() >= MIN_WORD_LENGTH) {
                titleTrie.insert(word, documentId);
            }
        }
        if (words.length > 1) {
            titleTrie.insert(String.join(" ", words), documentId);
        }
    }

    private void indexPhrases(final String content, final int documentId) {
        for (final String sentence : SENTENCE_END.split(content.toLowerCase(Locale.ROOT))) {
            final List<String> words = new ArrayList<>();
            for (final String word : WHITESPACE.split(sentence.trim())) {
                if (word.length() >= MIN_WORD_LENGTH) {
                    words.add(word);
                }
            }
            for (int length = MIN_PHRASE_WORDS; length <= MAX_PHRASE_WORDS && length <= words.size(); length++) {
                for (int i = 0; i + length <= words.size(); i++) {
                    final String phrase = String.join(" ", words.subList(i, i + length));
                    if (phrase.length() >= MIN_PHRASE_LENGTH && phrase.length() <= MAX_PHRASE_LENGTH) {
                        phraseTrie.insert(phrase, documentId);
                    }
                }
            }
        }
    }

    private List<Suggestion> completions(final TrieNode root, final String prefix, final SuggestionType type,
                                         final int maxResults) {
        final TrieNode start = root.find(prefix);
        if (start == null) {
            return List.of();
        }
        final List<TrieNode> found = new ArrayList<>();
        start.collect(found, maxResults);

        final List<Suggestion> suggestions = new ArrayList<>(found.size());
        for (final TrieNode node : found) {
            suggestions.add(new Suggestion(node.value, type, completionScore(node.value, prefix, node.frequency),
                    node.documentCount));
        }
        return suggestions;
    }

    /**
     * Frequency (up to 40), closeness in length (up to 30) and 30 for a true prefix.
     */
    static int completionScore(final String suggestion, final String prefix, final int frequency) {
        int score = Math.min(40, frequency * 10);
        score += Math.max(0, 30 - Math.abs(suggestion.length() - prefix.length()) * 2);
        if (suggestion.startsWith(prefix)) {
            score += 30;
        }
        return score;
    }

    private List<Suggestion> corrections(final String prefix, final int maxCorrections) {
        final Set<String> vocabulary = new LinkedHashSet<>();
        for (final TrieNode node : titleTrie.terminals()) {
            vocabulary.add(node.value);
        }
        for (final TrieNode node : tagTrie.terminals()) {
            vocabulary.add(node.value);
        }
        vocabulary.removeIf(word -> !fuzzyMatcher.isWithinEditDistance(prefix, word));

        final List<Suggestion> corrections = new ArrayList<>();
        for (final FuzzyMatch match : fuzzyMatcher.findBestMatches(prefix, vocabulary, maxCorrections,
                CORRECTION_MIN_SIMILARITY)) {
            corrections.add(new Suggestion(match.value(), SuggestionType.CORRECTION,
                    (int) Math.round(match.similarity() * 100), 0));
        }
        return corrections;
    }

    private static final class TrieNode {

        private final Map<Character, TrieNode> children = new TreeMap<>();
        private String value = "";
        private boolean terminal;
        private int frequency;
        private int documentCount;
        private int lastDocumentId;
        private int maxSubtreeFrequency;

        void insert(final String word, final int documentId) {
            final List<TrieNode> path = new ArrayList<>();
            TrieNode node = this;
            path.add(node);
            for (int i = 0; i < word.length(); i++) {
                node = node.children.computeIfAbsent(word.charAt(i), c -> new TrieNode());
                path.add(node);
            }
            node.terminal = true;
            node.value = word;
            node.frequency++;
            if (node.lastDocumentId != documentId) {
                node.lastDocumentId = documentId;
                node.documentCount++;
            }
            for (final TrieNode onPath : path) {
                onPath.maxSubtreeFrequency = Math.max(onPath.maxSubtreeFrequency, node.frequency);
            }
        }

        @Nullable TrieNode find(final String prefix) {
            TrieNode node = this;
            for (int i = 0; i < prefix.length() && node != null; i++) {
                node = node.children.get(prefix.charAt(i));
            }
            return node;
        }

        /**
         * Depth-first, visiting children with the most frequent subtree first.
         */
        void collect(final List<TrieNode> results, final int maxResults) {
            if (results.size() >= maxResults) {
                return;
            }
            if (terminal) {
                results.add(this);
            }
            final List<TrieNode> ordered = new ArrayList<>(children.values());
            ordered.sort(Comparator.comparingInt((TrieNode child) -> child.maxSubtreeFrequency).reversed());
            for (final TrieNode child : ordered) {
                if (results.size() >= maxResults) {
                    return;
                }
                child.collect(results, maxResults);
            }
        }

        List<TrieNode> terminals() {
            final List<TrieNode> result = new ArrayList<>();
            final List<TrieNode> stack = new ArrayList<>();
            stack.add(this);
            while (!stack.isEmpty()) {
                final TrieNode node = stack.remove(stack.size() - 1);
                if (node.terminal) {
                    result.add(node);
                }
                stack.addAll(node.children.values());
            }
            return result;
        }
    }
}
