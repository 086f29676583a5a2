package io.sentex.token;

import io.sentex.core.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into alternating runs of word characters (letters, numbers,
 * apostrophe, hyphen) and everything else.
 * <p>
 * Whitespace is collapsed first, then every run is stripped and blank runs
 * are dropped. Word runs keep hyphenated compounds ({@code hi-tech}) and
 * contractions ({@code I'm}) intact. Punctuation runs such as {@code ","}
 * or {@code "?!"} are non-blank after stripping and come out as tokens of
 * their own.
 */
public final class StrictTokenizer implements Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern RUN = Pattern.compile("[\\p{L}\\p{N}'-]+|[^\\p{L}\\p{N}'-]+");

    private final boolean caseSensitive;

    public StrictTokenizer() {
        this(false);
    }

    public StrictTokenizer(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        Matcher matcher = RUN.matcher(collapsed);
        while (matcher.find()) {
            String run = matcher.group().strip();
            if (run.isEmpty()) {
                continue;
            }
            tokens.add(caseSensitive ? run : run.toLowerCase(Locale.ROOT));
        }
        return tokens;
    }
}
