package io.sentex.token;

import io.sentex.core.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits on every run of characters that is neither a Unicode letter nor a
 * Unicode number. Hyphens and apostrophes therefore separate tokens:
 * {@code "hi-tech"} yields {@code [hi, tech]}.
 */
public final class DefaultTokenizer implements Tokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final boolean caseSensitive;

    public DefaultTokenizer() {
        this(false);
    }

    public DefaultTokenizer(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String[] fragments = SEPARATOR.split(text);
        List<String> tokens = new ArrayList<>(fragments.length);
        for (String fragment : fragments) {
            if (fragment.isEmpty()) {
                continue;
            }
            tokens.add(caseSensitive ? fragment : fragment.toLowerCase(Locale.ROOT));
        }
        return tokens;
    }
}
