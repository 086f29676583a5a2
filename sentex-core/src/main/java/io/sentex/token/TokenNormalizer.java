package io.sentex.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case policy shared by indexing, queries and suggestions.
 */
public final class TokenNormalizer {

    private final boolean caseSensitive;

    public TokenNormalizer(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public String normalize(String token) {
        return caseSensitive ? token : token.toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes every token, dropping {@code null} and empty entries a
     * custom tokenizer may produce.
     */
    public List<String> normalizeAll(List<String> tokens) {
        List<String> normalized = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (token == null || token.isEmpty()) {
                continue;
            }
            normalized.add(normalize(token));
        }
        return normalized;
    }
}
