package io.sentex.benchmarks;

import io.sentex.core.SentexConfiguration;
import io.sentex.finder.SentenceFinder;
import io.sentex.query.SearchOptions;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Search and suggestion throughput over a synthetic collection.
 * Covers exact, prefix fallback, partial and ranked lookups.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class SentenceFinderBenchmark {

    private static final String[] SUBJECTS = {"fox", "dog", "engineer", "teacher", "river", "station", "garden", "pilot"};
    private static final String[] VERBS = {"jumps", "waits", "builds", "teaches", "flows", "closes", "grows", "lands"};
    private static final String[] PLACES = {"north", "harbour", "valley", "market", "airport", "forest", "campus", "bridge"};

    @Param({"1000", "10000", "100000"})
    public int sentenceCount;

    private SentenceFinder finder;
    private List<String> sentences;

    private final SearchOptions ranked = SearchOptions.builder().ranked(true).build();
    private final SearchOptions partial = SearchOptions.builder().partial(true).build();

    @Setup(Level.Trial)
    public void setup() {
        sentences = new ArrayList<>(sentenceCount);
        for (int i = 0; i < sentenceCount; i++) {
            sentences.add(generateSentence(i));
        }
        finder = new SentenceFinder(SentexConfiguration.defaults()).initialize(sentences);
        // warm the suggestion snapshot so suggest() measures lookups only
        finder.suggest("a");
    }

    private static String generateSentence(int index) {
        String subject = SUBJECTS[index % SUBJECTS.length];
        String verb = VERBS[(index / SUBJECTS.length) % VERBS.length];
        String place = PLACES[(index / (SUBJECTS.length * VERBS.length)) % PLACES.length];
        return "The " + subject + index + " " + verb + " near the " + place;
    }

    @Benchmark
    public void initialize(Blackhole blackhole) {
        blackhole.consume(new SentenceFinder().initialize(sentences));
    }

    @Benchmark
    public void search_exact(Blackhole blackhole) {
        blackhole.consume(finder.searchArray("harbour"));
    }

    @Benchmark
    public void search_prefixFallback(Blackhole blackhole) {
        blackhole.consume(finder.searchArray("engin"));
    }

    @Benchmark
    public void search_partial(Blackhole blackhole) {
        blackhole.consume(finder.searchArray("arbo", partial));
    }

    @Benchmark
    public void search_ranked(Blackhole blackhole) {
        blackhole.consume(finder.searchArray("fox jumps valley", ranked));
    }

    @Benchmark
    public void suggest_shortPrefix(Blackhole blackhole) {
        blackhole.consume(finder.suggest("f"));
    }

    @Benchmark
    public void suggest_longPrefix(Blackhole blackhole) {
        blackhole.consume(finder.suggest("teacher12"));
    }
}
