package io.sentex.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Mutable property holder for a sentence finder, bound from
 * {@link Properties}.
 * <p>
 * Recognised keys:
 * <ul>
 *   <li>{@code sentex.min-match-count}</li>
 *   <li>{@code sentex.case-sensitive}</li>
 *   <li>{@code sentex.strict-tokens}</li>
 * </ul>
 * Missing keys keep their defaults. A custom tokenizer cannot be expressed as
 * a property; set it on the builder instead.
 */
public class SentexConfigurationProperties {

    public static final String PREFIX = "sentex.";
    public static final String MIN_MATCH_COUNT = PREFIX + "min-match-count";
    public static final String CASE_SENSITIVE = PREFIX + "case-sensitive";
    public static final String STRICT_TOKENS = PREFIX + "strict-tokens";

    /**
     * Classpath resource read by {@link #load()}.
     */
    public static final String DEFAULT_RESOURCE = "sentex.properties";

    private int minMatchCount = SentexConfiguration.DEFAULT_MIN_MATCH_COUNT;
    private boolean caseSensitive;
    private boolean strictTokens;

    public SentexConfigurationProperties() {
    }

    /**
     * Binds the recognised keys of the given properties.
     *
     * @param properties source properties
     * @return bound property holder
     * @throws InvalidInputException if a value cannot be parsed
     */
    public static SentexConfigurationProperties fromProperties(Properties properties) {
        SentexConfigurationProperties bound = new SentexConfigurationProperties();
        String minMatch = properties.getProperty(MIN_MATCH_COUNT);
        if (minMatch != null) {
            try {
                bound.setMinMatchCount(Integer.parseInt(minMatch.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidInputException(MIN_MATCH_COUNT + " is not an integer: '" + minMatch + "'", e);
            }
        }
        String caseSensitive = properties.getProperty(CASE_SENSITIVE);
        if (caseSensitive != null) {
            bound.setCaseSensitive(parseBoolean(CASE_SENSITIVE, caseSensitive));
        }
        String strictTokens = properties.getProperty(STRICT_TOKENS);
        if (strictTokens != null) {
            bound.setStrictTokens(parseBoolean(STRICT_TOKENS, strictTokens));
        }
        return bound;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the context class loader. A missing
     * resource yields the defaults.
     *
     * @return bound property holder
     */
    public static SentexConfigurationProperties load() {
        return load(DEFAULT_RESOURCE);
    }

    public static SentexConfigurationProperties load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SentexConfigurationProperties.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return new SentexConfigurationProperties();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new SentexException("Failed to read " + resource, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new InvalidInputException(key + " must be true or false, was '" + value + "'");
    }

    public int getMinMatchCount() {
        return minMatchCount;
    }

    public void setMinMatchCount(int minMatchCount) {
        this.minMatchCount = minMatchCount;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public boolean isStrictTokens() {
        return strictTokens;
    }

    public void setStrictTokens(boolean strictTokens) {
        this.strictTokens = strictTokens;
    }

    /**
     * Creates the immutable configuration from these bound properties.
     *
     * @return sentex configuration
     */
    public SentexConfiguration toConfiguration() {
        return SentexConfiguration.builder()
                .minMatchCount(minMatchCount)
                .caseSensitive(caseSensitive)
                .strictTokens(strictTokens)
                .build();
    }
}
