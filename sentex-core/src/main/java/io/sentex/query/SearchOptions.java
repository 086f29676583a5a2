package io.sentex.query;

import java.util.OptionalInt;

/**
 * Per-call search switches.
 * <pre>
 * SearchOptions options = SearchOptions.builder()
 *     .ranked(true)
 *     .minMatchCount(2)
 *     .build();
 * </pre>
 */
public final class SearchOptions {

    private static final SearchOptions DEFAULTS = builder().build();

    private final boolean ranked;
    private final boolean partial;
    private final Integer minMatchCount;

    private SearchOptions(Builder builder) {
        this.ranked = builder.ranked;
        this.partial = builder.partial;
        this.minMatchCount = builder.minMatchCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SearchOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @return true to sort results by relevance score
     */
    public boolean ranked() {
        return ranked;
    }

    /**
     * @return true to match query tokens anywhere inside dictionary words
     */
    public boolean partial() {
        return partial;
    }

    /**
     * @return override of the configured minimum match count, if any
     */
    public OptionalInt minMatchCount() {
        return minMatchCount == null ? OptionalInt.empty() : OptionalInt.of(minMatchCount);
    }

    public int minMatchCountOr(int fallback) {
        return minMatchCount == null ? fallback : minMatchCount;
    }

    public static class Builder {
        private boolean ranked;
        private boolean partial;
        private Integer minMatchCount;

        private Builder() {
        }

        public Builder ranked(boolean ranked) {
            this.ranked = ranked;
            return this;
        }

        public Builder partial(boolean partial) {
            this.partial = partial;
            return this;
        }

        /**
         * @param minMatchCount at least 1
         */
        public Builder minMatchCount(int minMatchCount) {
            if (minMatchCount < 1) {
                throw new IllegalArgumentException("minMatchCount must be at least 1, was " + minMatchCount);
            }
            this.minMatchCount = minMatchCount;
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(this);
        }
    }
}
