package io.sentex.query;

import io.sentex.index.SentenceIndex;

import java.util.Objects;

/**
 * Prefix lookups over the dictionary words of a {@link SentenceIndex}.
 */
public final class WordSuggester {

    private final SentenceIndex index;

    public WordSuggester(SentenceIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * @param prefix raw prefix, normalized with the index's case policy
     * @param limit  maximum number of suggestions, must be positive
     */
    public SuggestResult suggest(String prefix, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, was " + limit);
        }
        if (prefix == null || prefix.isBlank()) {
            return SuggestResult.empty();
        }
        String normalized = index.analyzer().normalize(prefix);
        return new SuggestResult(index.suggestions().startsWith(normalized, limit));
    }

    public SuggestResult suggest(String prefix) {
        return suggest(prefix, Integer.MAX_VALUE);
    }
}
