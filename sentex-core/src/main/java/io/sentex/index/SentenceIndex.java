package io.sentex.index;

import io.sentex.core.InvalidInputException;
import io.sentex.token.TextAnalyzer;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Owns the sentence collection and everything derived from it: dictionary,
 * frequency table, text lookup and suggestion snapshot.
 * <p>
 * Every position stored in the dictionary is a valid position in the
 * collection. Mutations go through {@link #initialize}, {@link #append} and
 * {@link #clear}, each of which invalidates the suggestion snapshot.
 * <p>
 * Not thread-safe.
 */
public final class SentenceIndex {

    private final TextAnalyzer analyzer;
    private final SentenceStore store = new SentenceStore();
    private final WordDictionary dictionary = new WordDictionary();
    private final SuggestionIndex suggestions = new SuggestionIndex(dictionary);

    public SentenceIndex(TextAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    /**
     * Replace the whole collection. The input is validated before any state
     * is touched.
     *
     * @throws InvalidInputException if {@code sentences} is null or holds a null entry
     */
    public void initialize(List<String> sentences) {
        if (sentences == null) {
            throw new InvalidInputException("sentences required");
        }
        for (int i = 0; i < sentences.size(); i++) {
            if (sentences.get(i) == null) {
                throw new InvalidInputException("sentence at position " + i + " is null");
            }
        }
        List<String> copy = List.copyOf(sentences);
        clear();
        for (String sentence : copy) {
            append(sentence);
        }
    }

    /**
     * Append one sentence at the next position and index its tokens.
     *
     * @return the new sentence's position
     */
    int append(String sentence) {
        int position = store.append(sentence);
        for (String token : analyzer.analyze(sentence)) {
            dictionary.add(token, position);
        }
        suggestions.invalidate();
        return position;
    }

    public void clear() {
        store.clear();
        dictionary.clear();
        suggestions.invalidate();
    }

    public int size() {
        return store.size();
    }

    public String sentence(int position) {
        return store.get(position);
    }

    public OptionalInt indexOf(String sentence) {
        return store.indexOf(sentence);
    }

    public List<String> sentences() {
        return store.asList();
    }

    List<String> snapshot() {
        return store.snapshot();
    }

    public WordDictionary dictionary() {
        return dictionary;
    }

    public SuggestionIndex suggestions() {
        return suggestions;
    }

    public TextAnalyzer analyzer() {
        return analyzer;
    }
}
