package io.sentex.query;

import io.sentex.index.PostingList;
import io.sentex.index.SentenceIndex;
import io.sentex.index.WordDictionary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a multi-token query against a {@link SentenceIndex}.
 * <p>
 * Each query token contributes sentences through one of two strategies:
 * <ul>
 *   <li><b>partial</b>: every dictionary word containing the token</li>
 *   <li><b>default</b>: the exact dictionary word, or when it is absent every
 *   dictionary word starting with the token</li>
 * </ul>
 * A sentence qualifies when it was matched by at least the minimum number
 * of <em>distinct</em> query tokens. Unranked results keep first-match
 * order; ranked results are ordered by {@link RankingScorer} score, then by
 * earliest matching token, then by collection position.
 */
public final class SearchEngine {

    private static final Comparator<RankedSentence> RANKING = Comparator
            .<RankedSentence>comparingInt(RankedSentence::score).reversed()
            .thenComparingInt(RankedSentence::earliestMatch)
            .thenComparingInt(RankedSentence::position);

    private final SentenceIndex index;

    public SearchEngine(SentenceIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * @param query          raw query text
     * @param options        per-call switches
     * @param minMatchCount  minimum used when the options carry no override
     * @return matching sentences, never null
     */
    public SearchResult search(String query, SearchOptions options, int minMatchCount) {
        if (query == null || query.isBlank()) {
            return SearchResult.empty();
        }
        SearchOptions effective = options == null ? SearchOptions.defaults() : options;
        List<String> queryTokens = index.analyzer().analyze(query);
        if (queryTokens.isEmpty()) {
            return SearchResult.empty();
        }

        MatchAccumulator matches = collect(queryTokens, effective.partial());
        List<Integer> positions = matches.qualifying(effective.minMatchCountOr(minMatchCount));
        if (positions.isEmpty()) {
            return SearchResult.empty();
        }
        if (!effective.ranked()) {
            List<String> results = new ArrayList<>(positions.size());
            for (int position : positions) {
                results.add(index.sentence(position));
            }
            return new SearchResult(results);
        }
        return new SearchResult(rank(positions, queryTokens));
    }

    private MatchAccumulator collect(List<String> queryTokens, boolean partial) {
        WordDictionary dictionary = index.dictionary();
        MatchAccumulator matches = new MatchAccumulator();
        for (String token : queryTokens) {
            if (!partial) {
                PostingList exact = dictionary.postings(token);
                if (exact != null) {
                    matches.record(exact, token);
                    continue;
                }
            }
            for (Map.Entry<String, PostingList> entry : dictionary.entries()) {
                String word = entry.getKey();
                boolean hit = partial ? word.contains(token) : word.startsWith(token);
                if (hit) {
                    matches.record(entry.getValue(), token);
                }
            }
        }
        return matches;
    }

    private List<String> rank(List<Integer> positions, List<String> queryTokens) {
        List<RankedSentence> ranked = new ArrayList<>(positions.size());
        for (int position : positions) {
            String text = index.sentence(position);
            RankingScorer.Score score = RankingScorer.score(index.analyzer().analyze(text), queryTokens);
            // Duplicate texts resolve to whichever position the lookup holds.
            int lookupPosition = index.indexOf(text).orElse(position);
            ranked.add(new RankedSentence(text, lookupPosition, score.score(), score.earliestMatch()));
        }
        ranked.sort(RANKING);
        List<String> results = new ArrayList<>(ranked.size());
        for (RankedSentence sentence : ranked) {
            results.add(sentence.text());
        }
        return results;
    }

    private record RankedSentence(String text, int position, int score, int earliestMatch) {
    }
}
