package io.sentex.query;

import java.util.List;

/**
 * @param suggestions dictionary words starting with the prefix, sorted
 */
public record SuggestResult(List<String> suggestions) {

    private static final SuggestResult EMPTY = new SuggestResult(List.of());

    public SuggestResult {
        suggestions = List.copyOf(suggestions);
    }

    public static SuggestResult empty() {
        return EMPTY;
    }

    public int size() {
        return suggestions.size();
    }

    public boolean isEmpty() {
        return suggestions.isEmpty();
    }
}
