package io.sentex.token;

import io.sentex.core.SentexConfiguration;
import io.sentex.core.Tokenizer;

public final class Tokenizers {

    private Tokenizers() {
    }

    /**
     * Picks the tokenizer a configuration asks for: the custom one when set,
     * otherwise strict or default.
     */
    public static Tokenizer select(SentexConfiguration configuration) {
        return configuration.tokenizer()
                .orElseGet(() -> configuration.strictTokens()
                        ? new StrictTokenizer(configuration.caseSensitive())
                        : new DefaultTokenizer(configuration.caseSensitive()));
    }
}
