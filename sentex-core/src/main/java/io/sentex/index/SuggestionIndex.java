package io.sentex.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Sorted snapshot of dictionary words for prefix lookups.
 * <p>
 * The snapshot is built lazily on the first lookup and dropped by
 * {@link #invalidate()}, which every dictionary mutation must call. Words
 * sharing a prefix are contiguous in lexicographic order, so a lookup is one
 * lower-bound binary search followed by a forward scan.
 */
public final class SuggestionIndex {

    private final WordDictionary dictionary;
    private String[] sortedWords;
    private boolean dirty = true;

    public SuggestionIndex(WordDictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    public void invalidate() {
        dirty = true;
        sortedWords = null;
    }

    public boolean isCached() {
        return !dirty && sortedWords != null;
    }

    /**
     * Words starting with the already-normalized prefix, in lexicographic order.
     *
     * @param prefix normalized, non-empty prefix
     * @param limit  maximum number of words to return
     */
    public List<String> startsWith(String prefix, int limit) {
        if (prefix == null || prefix.isEmpty() || limit <= 0) {
            return List.of();
        }
        String[] words = sortedWords();
        List<String> matches = new ArrayList<>();
        for (int i = lowerBound(words, prefix); i < words.length && matches.size() < limit; i++) {
            if (!words[i].startsWith(prefix)) {
                break;
            }
            matches.add(words[i]);
        }
        return matches;
    }

    public List<String> startsWith(String prefix) {
        return startsWith(prefix, Integer.MAX_VALUE);
    }

    private String[] sortedWords() {
        if (dirty || sortedWords == null) {
            String[] words = dictionary.words().toArray(new String[0]);
            Arrays.sort(words);
            sortedWords = words;
            dirty = false;
        }
        return sortedWords;
    }

    static int lowerBound(String[] words, String key) {
        int low = 0;
        int high = words.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (words[mid].compareTo(key) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
