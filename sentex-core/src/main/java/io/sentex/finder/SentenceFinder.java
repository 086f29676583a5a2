package io.sentex.finder;

import io.sentex.core.CountListener;
import io.sentex.core.EventListeners;
import io.sentex.core.InvalidArgumentException;
import io.sentex.core.SentexConfiguration;
import io.sentex.core.SentexEvent;
import io.sentex.index.IndexMerger;
import io.sentex.index.MergeOptions;
import io.sentex.index.MergeReport;
import io.sentex.index.SentenceIndex;
import io.sentex.query.SearchEngine;
import io.sentex.query.SearchOptions;
import io.sentex.query.SearchResult;
import io.sentex.query.SuggestResult;
import io.sentex.query.WordSuggester;
import io.sentex.token.TextAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * In-memory sentence index with token search, ranked retrieval and word
 * suggestion.
 * <p>
 * Typical use:
 * <pre>
 * SentenceFinder finder = new SentenceFinder(SentexConfiguration.builder()
 *         .strictTokens(true)
 *         .build())
 *     .initialize(List.of("The quick brown fox", "Quick foxes run"))
 *     .on(SentexEvent.SEARCH, count -&gt; System.out.println(count + " matches"));
 *
 * List&lt;String&gt; hits = finder.searchArray("fox", SearchOptions.builder().ranked(true).build());
 * </pre>
 * <p>
 * The collection changes only as a whole: {@link #initialize} replaces it,
 * {@link #merge} appends another finder's sentences and {@link #reset}
 * empties it. Listeners registered with {@link #on} and {@link #onReset} are
 * notified synchronously after each operation completes.
 * <p>
 * Instances are not thread-safe. Concurrent use requires one
 * read/write lock around the whole finder, since searches read the same
 * structures the mutators change.
 */
public final class SentenceFinder {

    private static final Logger LOG = LoggerFactory.getLogger(SentenceFinder.class);

    private final SentexConfiguration configuration;
    private final SentenceIndex index;
    private final SearchEngine searchEngine;
    private final WordSuggester suggester;
    private final EventListeners listeners = new EventListeners();

    public SentenceFinder() {
        this(SentexConfiguration.defaults());
    }

    public SentenceFinder(SentexConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.index = new SentenceIndex(TextAnalyzer.from(configuration));
        this.searchEngine = new SearchEngine(index);
        this.suggester = new WordSuggester(index);
    }

    /**
     * Replace the collection and rebuild every derived structure.
     *
     * @param sentences sentences to index; positions follow list order
     * @return this finder
     * @throws io.sentex.core.InvalidInputException if the list or one of its entries is null
     */
    public SentenceFinder initialize(List<String> sentences) {
        index.initialize(sentences);
        LOG.debug("Initialized with {} sentences, {} distinct words", index.size(), index.dictionary().size());
        listeners.fire(SentexEvent.INIT, index.size());
        return this;
    }

    public SearchResult search(String query) {
        return search(query, SearchOptions.defaults());
    }

    /**
     * Find sentences matching the query tokens.
     *
     * @param query   query text; blank text yields an empty result
     * @param options ranking, partial matching and minimum match override
     * @return matching sentences
     */
    public SearchResult search(String query, SearchOptions options) {
        SearchResult result = searchEngine.search(query, options, configuration.minMatchCount());
        if (LOG.isTraceEnabled()) {
            LOG.trace("Search '{}' returned {} of {} sentences", query, result.size(), index.size());
        }
        listeners.fire(SentexEvent.SEARCH, result.size());
        return result;
    }

    public List<String> searchArray(String query) {
        return search(query).results();
    }

    public List<String> searchArray(String query, SearchOptions options) {
        return search(query, options).results();
    }

    /**
     * Dictionary words starting with the prefix, in lexicographic order.
     * A blank prefix returns an empty result without notifying listeners.
     */
    public SuggestResult suggest(String prefix) {
        return suggest(prefix, Integer.MAX_VALUE);
    }

    public SuggestResult suggest(String prefix, int limit) {
        SuggestResult result = suggester.suggest(prefix, limit);
        if (prefix == null || prefix.isBlank()) {
            return result;
        }
        LOG.trace("Suggest '{}' returned {} words", prefix, result.size());
        listeners.fire(SentexEvent.SUGGEST, result.size());
        return result;
    }

    public SentenceFinder merge(SentenceFinder other) {
        return merge(other, MergeOptions.defaults());
    }

    /**
     * Append the sentences of another finder, re-indexed with this finder's
     * tokenizer and case policy.
     *
     * @param other   finder to read sentences from; it is not modified
     * @param options deduplication switch
     * @return this finder
     * @throws InvalidArgumentException if {@code other} is null
     */
    public SentenceFinder merge(SentenceFinder other, MergeOptions options) {
        if (other == null) {
            throw new InvalidArgumentException("Can only merge with another SentenceFinder, got null");
        }
        MergeReport report = IndexMerger.merge(index, other.index, options);
        LOG.debug("Merged {} sentences at offset {}: {} appended, {} skipped as duplicates",
                report.sourceCount(), report.offset(), report.appended(), report.skipped());
        listeners.fire(SentexEvent.MERGE, report.sourceCount());
        return this;
    }

    public SentenceFinder reset() {
        index.clear();
        LOG.debug("Reset");
        listeners.fireReset();
        return this;
    }

    public SentenceFinder on(SentexEvent event, CountListener listener) {
        listeners.on(event, listener);
        return this;
    }

    public SentenceFinder onReset(Runnable listener) {
        listeners.onReset(listener);
        return this;
    }

    /**
     * Live read-only view of word to sentence positions. Positions repeat
     * when a word occurs more than once in a sentence.
     */
    public Map<String, List<Integer>> getDictionary() {
        return index.dictionary().asMap();
    }

    /**
     * Live read-only view of word to total occurrence count.
     */
    public Map<String, Integer> getWordFrequency() {
        return index.dictionary().frequencyMap();
    }

    /**
     * Occurrence count of a word, normalized with this finder's case policy.
     */
    public int frequencyOf(String word) {
        if (word == null || word.isEmpty()) {
            return 0;
        }
        return index.dictionary().frequency(index.analyzer().normalize(word));
    }

    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.size() == 0;
    }

    public List<String> sentences() {
        return index.sentences();
    }

    public String sentence(int position) {
        return index.sentence(position);
    }

    /**
     * Position of an exact sentence text. For texts stored more than once
     * this is the last stored position.
     */
    public OptionalInt indexOf(String sentence) {
        return index.indexOf(sentence);
    }

    public SentexConfiguration configuration() {
        return configuration;
    }

    SentenceIndex index() {
        return index;
    }
}
