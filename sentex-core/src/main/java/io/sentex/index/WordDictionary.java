package io.sentex.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token to posting list dictionary plus the per-token occurrence counts.
 * <p>
 * Keys iterate in first-insertion order. For every token the frequency
 * equals the size of its posting list.
 */
public final class WordDictionary {

    private final Map<String, PostingList> postings = new LinkedHashMap<>();
    private final Map<String, Integer> frequency = new LinkedHashMap<>();

    // Mirrors postings with List views so callers never see PostingList.
    private final Map<String, List<Integer>> postingViews = new LinkedHashMap<>();

    private final Map<String, List<Integer>> dictionaryView = Collections.unmodifiableMap(postingViews);
    private final Map<String, Integer> frequencyView = Collections.unmodifiableMap(frequency);

    /**
     * Record one occurrence of {@code token} in the sentence at {@code position}.
     */
    public void add(String token, int position) {
        if (token == null) {
            throw new IllegalArgumentException("token required");
        }
        PostingList list = postings.get(token);
        if (list == null) {
            list = new PostingList();
            postings.put(token, list);
            postingViews.put(token, list.asList());
        }
        list.add(position);
        frequency.merge(token, 1, Integer::sum);
    }

    public boolean contains(String token) {
        return postings.containsKey(token);
    }

    /**
     * @return the posting list for the token, or {@code null} when absent
     */
    public PostingList postings(String token) {
        return postings.get(token);
    }

    public int frequency(String token) {
        return frequency.getOrDefault(token, 0);
    }

    public Set<String> words() {
        return Collections.unmodifiableSet(postings.keySet());
    }

    public Set<Map.Entry<String, PostingList>> entries() {
        return Collections.unmodifiableMap(postings).entrySet();
    }

    public int size() {
        return postings.size();
    }

    public void clear() {
        postings.clear();
        frequency.clear();
        postingViews.clear();
    }

    /**
     * Live read-only view: token to sentence positions.
     */
    public Map<String, List<Integer>> asMap() {
        return dictionaryView;
    }

    /**
     * Live read-only view: token to occurrence count.
     */
    public Map<String, Integer> frequencyMap() {
        return frequencyView;
    }
}
