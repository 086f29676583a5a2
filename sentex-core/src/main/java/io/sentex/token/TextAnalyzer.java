package io.sentex.token;

import io.sentex.core.SentexConfiguration;
import io.sentex.core.Tokenizer;

import java.util.List;
import java.util.Objects;

/**
 * Tokenizer plus normalizer: the single path every piece of text takes
 * before it touches the dictionary.
 */
public final class TextAnalyzer {

    private final Tokenizer tokenizer;
    private final TokenNormalizer normalizer;

    public TextAnalyzer(Tokenizer tokenizer, TokenNormalizer normalizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public static TextAnalyzer from(SentexConfiguration configuration) {
        return new TextAnalyzer(Tokenizers.select(configuration), new TokenNormalizer(configuration.caseSensitive()));
    }

    public List<String> analyze(String text) {
        if (text == null) {
            return List.of();
        }
        List<String> tokens = tokenizer.tokenize(text);
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        return normalizer.normalizeAll(tokens);
    }

    public String normalize(String token) {
        return normalizer.normalize(token);
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }
}
