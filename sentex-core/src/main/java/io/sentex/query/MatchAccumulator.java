package io.sentex.query;

import io.sentex.index.PostingList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-search record of which distinct query tokens matched each sentence.
 * Sentences iterate in the order they were first matched.
 */
final class MatchAccumulator {

    private final Map<Integer, Set<String>> matches = new LinkedHashMap<>();

    void record(PostingList postings, String queryToken) {
        for (int i = 0; i < postings.size(); i++) {
            matches.computeIfAbsent(postings.get(i), ignored -> new LinkedHashSet<>()).add(queryToken);
        }
    }

    /**
     * Positions matched by at least {@code minMatchCount} distinct query tokens.
     */
    List<Integer> qualifying(int minMatchCount) {
        List<Integer> positions = new ArrayList<>();
        for (Map.Entry<Integer, Set<String>> entry : matches.entrySet()) {
            if (entry.getValue().size() >= minMatchCount) {
                positions.add(entry.getKey());
            }
        }
        return positions;
    }
}
