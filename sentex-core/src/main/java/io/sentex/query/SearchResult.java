package io.sentex.query;

import java.util.List;

/**
 * @param results matching sentences, ranked when requested
 */
public record SearchResult(List<String> results) {

    private static final SearchResult EMPTY = new SearchResult(List.of());

    public SearchResult {
        results = List.copyOf(results);
    }

    public static SearchResult empty() {
        return EMPTY;
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
