package io.sentex.finder;

import io.sentex.core.SentexConfiguration;
import io.sentex.index.MergeOptions;
import io.sentex.query.SearchOptions;
import io.sentex.token.DefaultTokenizer;
import io.sentex.token.StrictTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour that must hold for any collection, checked over a small corpus.
 */
class SentenceFinderPropertiesTest {

    private static final List<String> CORPUS = List.of(
            "The quick brown fox jumps over the lazy dog",
            "Quick foxes are known for jumping",
            "Dogs are usually lazy in the afternoon",
            "I'm sure the hi-tech gadget works",
            "Route 66 runs west, mostly",
            "Café owners open early",
            "quick quick quick");

    private static final SearchOptions MIN_ONE = SearchOptions.builder().minMatchCount(1).build();

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    void everySentenceIsFoundByEachOfItsTokens(boolean strict) {
        SentenceFinder finder = new SentenceFinder(SentexConfiguration.builder()
                .strictTokens(strict)
                .minMatchCount(3)
                .build())
                .initialize(CORPUS);

        for (String sentence : CORPUS) {
            List<String> tokens = strict
                    ? new StrictTokenizer().tokenize(sentence)
                    : new DefaultTokenizer().tokenize(sentence);
            for (String token : tokens) {
                assertThat(finder.searchArray(token, MIN_ONE))
                        .as("token '%s' of '%s'", token, sentence)
                        .contains(sentence);
            }
        }
    }

    @Test
    void suggestReturnsExactlyTheWordsWithThePrefix() {
        SentenceFinder finder = new SentenceFinder().initialize(CORPUS);
        Set<String> words = finder.getDictionary().keySet();

        Set<String> prefixes = new TreeSet<>();
        for (String word : words) {
            for (int i = 1; i <= word.length(); i++) {
                prefixes.add(word.substring(0, i));
            }
        }
        prefixes.add("zz");

        for (String prefix : prefixes) {
            List<String> expected = words.stream()
                    .filter(word -> word.startsWith(prefix))
                    .sorted()
                    .collect(Collectors.toList());
            assertThat(finder.suggest(prefix).suggestions()).as("prefix '%s'", prefix)
                    .containsExactlyElementsOf(expected);
        }
        assertThat(finder.suggest("").suggestions()).isEmpty();
    }

    @Test
    void rankedSearchIsStableAcrossCalls() {
        SentenceFinder finder = new SentenceFinder().initialize(CORPUS);
        SearchOptions ranked = SearchOptions.builder().ranked(true).build();

        List<String> first = finder.searchArray("quick lazy fox", ranked);
        for (int i = 0; i < 10; i++) {
            assertThat(finder.searchArray("quick lazy fox", ranked)).containsExactlyElementsOf(first);
        }
        assertThat(first.get(0)).isEqualTo("quick quick quick");
    }

    @Test
    void deduplicatingMergeOfDuplicatesNeverGrows() {
        SentenceFinder target = new SentenceFinder().initialize(CORPUS);
        SentenceFinder copy = new SentenceFinder().initialize(CORPUS);

        target.merge(copy, MergeOptions.deduplicating());
        int afterFirst = target.size();
        target.merge(copy, MergeOptions.deduplicating());

        assertThat(afterFirst).isEqualTo(CORPUS.size());
        assertThat(target.size()).isEqualTo(afterFirst);
    }

    @Test
    void prefixFallbackOnlyAppliesToDictionaryMisses() {
        SentenceFinder finder = new SentenceFinder().initialize(List.of("The quick brown fox", "Quick foxes run"));

        assertThat(finder.searchArray("fox", SearchOptions.builder().minMatchCount(1).partial(true).build()))
                .containsExactly("The quick brown fox", "Quick foxes run");
        assertThat(finder.searchArray("fox", MIN_ONE)).containsExactly("The quick brown fox");
        assertThat(finder.searchArray("foxe", MIN_ONE)).containsExactly("Quick foxes run");
        assertThat(finder.searchArray("foxy", MIN_ONE)).isEmpty();
    }

    @Test
    void strictAndDefaultTokenizersTreatHyphensDifferently() {
        List<String> sentences = List.of("hi-tech solution", "high tech answer");
        SentenceFinder strict = new SentenceFinder(SentexConfiguration.builder().strictTokens(true).build())
                .initialize(sentences);
        SentenceFinder lenient = new SentenceFinder().initialize(sentences);

        assertThat(strict.searchArray("hi-tech")).containsExactly("hi-tech solution");
        assertThat(lenient.searchArray("hi-tech")).containsExactly("hi-tech solution", "high tech answer");
        assertThat(strict.getDictionary()).containsKey("hi-tech").doesNotContainKey("hi");
        assertThat(lenient.getDictionary()).containsKeys("hi", "tech").doesNotContainKey("hi-tech");
    }

    @Test
    void resetLeavesNothingToFind() {
        SentenceFinder finder = new SentenceFinder().initialize(CORPUS);
        finder.suggest("qu");

        finder.reset();

        assertThat(finder.searchArray("quick")).isEmpty();
        assertThat(finder.searchArray("qu", SearchOptions.builder().partial(true).build())).isEmpty();
        assertThat(finder.suggest("qu").suggestions()).isEmpty();
    }
}
