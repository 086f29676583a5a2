package io.sentex.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Append-only sentence collection with an exact-text position lookup.
 * <p>
 * When the same text is stored twice the lookup keeps the later position.
 */
public final class SentenceStore {

    private final List<String> sentences = new ArrayList<>();
    private final Map<String, Integer> positionsByText = new HashMap<>();
    private final List<String> view = Collections.unmodifiableList(sentences);

    public int append(String sentence) {
        int position = sentences.size();
        sentences.add(sentence);
        positionsByText.put(sentence, position);
        return position;
    }

    public String get(int position) {
        return sentences.get(position);
    }

    public OptionalInt indexOf(String sentence) {
        Integer position = positionsByText.get(sentence);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    public boolean contains(String sentence) {
        return positionsByText.containsKey(sentence);
    }

    public int size() {
        return sentences.size();
    }

    public boolean isEmpty() {
        return sentences.isEmpty();
    }

    public List<String> asList() {
        return view;
    }

    public List<String> snapshot() {
        return List.copyOf(sentences);
    }

    public void clear() {
        sentences.clear();
        positionsByText.clear();
    }
}
