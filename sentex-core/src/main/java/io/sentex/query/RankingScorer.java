package io.sentex.query;

import java.util.List;

/**
 * Scores a sentence against the query tokens.
 * <p>
 * Every occurrence of a query token inside a sentence token earns
 * {@link #EXACT_WEIGHT} when the sentence token equals the query token,
 * {@link #PREFIX_WEIGHT} when the sentence token starts with it and
 * {@link #SUBSTRING_WEIGHT} otherwise. Occurrences are counted
 * left to right without overlap.
 */
public final class RankingScorer {

    public static final int EXACT_WEIGHT = 10;
    public static final int PREFIX_WEIGHT = 2;
    public static final int SUBSTRING_WEIGHT = 1;

    /**
     * Position reported when no query token occurs in the sentence.
     */
    public static final int NO_MATCH = Integer.MAX_VALUE;

    private RankingScorer() {
    }

    /**
     * @param score         summed weight over all query tokens and occurrences
     * @param earliestMatch smallest sentence-token position holding any query
     *                      token, or {@link #NO_MATCH}
     */
    public record Score(int score, int earliestMatch) {
    }

    public static Score score(List<String> sentenceTokens, List<String> queryTokens) {
        int total = 0;
        int earliest = NO_MATCH;
        for (String queryToken : queryTokens) {
            for (int position = 0; position < sentenceTokens.size(); position++) {
                int points = occurrenceScore(sentenceTokens.get(position), queryToken);
                if (points > 0) {
                    total += points;
                    earliest = Math.min(earliest, position);
                }
            }
        }
        return new Score(total, earliest);
    }

    static int occurrenceScore(String sentenceToken, String queryToken) {
        if (queryToken.isEmpty()) {
            return 0;
        }
        int weight;
        if (sentenceToken.equals(queryToken)) {
            weight = EXACT_WEIGHT;
        } else if (sentenceToken.startsWith(queryToken)) {
            weight = PREFIX_WEIGHT;
        } else {
            weight = SUBSTRING_WEIGHT;
        }
        int points = 0;
        int from = 0;
        while (true) {
            int found = sentenceToken.indexOf(queryToken, from);
            if (found < 0) {
                break;
            }
            points += weight;
            from = found + queryToken.length();
        }
        return points;
    }
}
