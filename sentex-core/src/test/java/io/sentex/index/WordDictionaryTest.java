package io.sentex.index;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordDictionaryTest {

    @Test
    void addRecordsPositionsAndFrequency() {
        WordDictionary dictionary = new WordDictionary();
        dictionary.add("fox", 0);
        dictionary.add("fox", 0);
        dictionary.add("fox", 2);

        assertThat(dictionary.postings("fox").toArray()).containsExactly(0, 0, 2);
        assertThat(dictionary.frequency("fox")).isEqualTo(3);
        assertThat(dictionary.frequency("dog")).isZero();
        assertThat(dictionary.postings("dog")).isNull();
    }

    @Test
    void wordsIterateInFirstInsertionOrder() {
        WordDictionary dictionary = new WordDictionary();
        dictionary.add("zebra", 0);
        dictionary.add("apple", 0);
        dictionary.add("zebra", 1);
        dictionary.add("mango", 1);

        assertThat(dictionary.words()).containsExactly("zebra", "apple", "mango");
    }

    @Test
    void viewsAreLiveAndReadOnly() {
        WordDictionary dictionary = new WordDictionary();
        Map<String, List<Integer>> view = dictionary.asMap();
        Map<String, Integer> frequency = dictionary.frequencyMap();

        dictionary.add("fox", 1);

        assertThat(view).containsOnlyKeys("fox");
        assertThat(view.get("fox")).containsExactly(1);
        assertThat(frequency).containsEntry("fox", 1);
        assertThatThrownBy(() -> view.put("dog", List.of())).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> frequency.put("dog", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void clearEmptiesEverything() {
        WordDictionary dictionary = new WordDictionary();
        dictionary.add("fox", 0);

        dictionary.clear();

        assertThat(dictionary.size()).isZero();
        assertThat(dictionary.asMap()).isEmpty();
        assertThat(dictionary.frequencyMap()).isEmpty();
    }

    @Test
    void addRejectsNullToken() {
        WordDictionary dictionary = new WordDictionary();

        assertThatThrownBy(() -> dictionary.add(null, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
