package io.sentex.core;

import java.util.Optional;

/**
 * Immutable configuration for a sentence finder.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * SentexConfiguration config = SentexConfiguration.builder()
 *     .minMatchCount(2)
 *     .strictTokens(true)
 *     .build();
 * </pre>
 * <p>
 * Case sensitivity and the tokenizer are fixed for the lifetime of the
 * finder built from this configuration.
 *
 * @see io.sentex.finder.SentenceFinder
 */
public final class SentexConfiguration {

    public static final int DEFAULT_MIN_MATCH_COUNT = 1;

    private static final SentexConfiguration DEFAULTS = builder().build();

    // Search filtering
    private final int minMatchCount;

    // Token normalization
    private final boolean caseSensitive;

    // Tokenizer selection
    private final boolean strictTokens;
    private final Tokenizer tokenizer;

    private SentexConfiguration(Builder builder) {
        this.minMatchCount = builder.minMatchCount;
        this.caseSensitive = builder.caseSensitive;
        this.strictTokens = builder.strictTokens;
        this.tokenizer = builder.tokenizer;
    }

    /**
     * Create a new builder for SentexConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every option at its default.
     */
    public static SentexConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Minimum number of distinct query tokens a sentence must match to be
     * returned, unless a search overrides it.
     *
     * @return minimum match count, at least 1
     */
    public int minMatchCount() {
        return minMatchCount;
    }

    /**
     * Check if tokens keep their case.
     *
     * @return true if indexing and queries are case-sensitive (default: false)
     */
    public boolean caseSensitive() {
        return caseSensitive;
    }

    /**
     * Check if the strict tokenizer is selected. Ignored when a custom
     * tokenizer is configured.
     *
     * @return true if hyphens and apostrophes are kept inside tokens
     */
    public boolean strictTokens() {
        return strictTokens;
    }

    public Optional<Tokenizer> tokenizer() {
        return Optional.ofNullable(tokenizer);
    }

    /**
     * Builder for SentexConfiguration.
     */
    public static class Builder {
        private int minMatchCount = DEFAULT_MIN_MATCH_COUNT;
        private boolean caseSensitive;
        private boolean strictTokens;
        private Tokenizer tokenizer;

        private Builder() {
        }

        /**
         * Set the default minimum number of distinct matching query tokens.
         *
         * @param minMatchCount minimum match count, at least 1
         * @return this builder for method chaining
         */
        public Builder minMatchCount(int minMatchCount) {
            this.minMatchCount = minMatchCount;
            return this;
        }

        /**
         * Enable or disable case-sensitive matching.
         *
         * @param caseSensitive true to keep token case
         * @return this builder for method chaining
         */
        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        /**
         * Select the strict tokenizer, which keeps hyphenated compounds and
         * contractions as single tokens.
         *
         * @param strictTokens true to select the strict tokenizer
         * @return this builder for method chaining
         */
        public Builder strictTokens(boolean strictTokens) {
            this.strictTokens = strictTokens;
            return this;
        }

        /**
         * Replace the built-in tokenizers. Pass {@code null} to go back to
         * the built-in selection.
         *
         * @param tokenizer custom tokenizer
         * @return this builder for method chaining
         */
        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        /**
         * Build the immutable SentexConfiguration.
         *
         * @return a new SentexConfiguration instance
         * @throws IllegalArgumentException if the minimum match count is below 1
         */
        public SentexConfiguration build() {
            if (minMatchCount < 1) {
                throw new IllegalArgumentException("minMatchCount must be at least 1, was " + minMatchCount);
            }
            return new SentexConfiguration(this);
        }
    }
}
