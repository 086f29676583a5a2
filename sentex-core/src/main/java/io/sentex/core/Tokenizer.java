package io.sentex.core;

import java.util.List;

/**
 * Splits text into an ordered list of tokens.
 * <p>
 * Implementations must be deterministic and must not mutate shared state.
 * The index lower-cases tokens itself when case-insensitive, so a custom
 * tokenizer may return tokens in any case.
 */
@FunctionalInterface
public interface Tokenizer {

    List<String> tokenize(String text);
}
