package io.sentex.index;

import io.sentex.core.InvalidArgumentException;

import java.util.List;
import java.util.Objects;

/**
 * Appends the sentences of one index to another.
 * <p>
 * Source postings are never copied: every retained sentence is re-tokenized
 * with the <em>receiving</em> index's analyzer, so its case policy and
 * tokenizer apply to merged text as well. Appended positions are contiguous
 * starting at the receiving size; skipped duplicates leave no gaps.
 */
public final class IndexMerger {

    private IndexMerger() {
    }

    /**
     * @throws InvalidArgumentException if {@code source} is null
     */
    public static MergeReport merge(SentenceIndex target, SentenceIndex source, MergeOptions options) {
        Objects.requireNonNull(target, "target");
        if (source == null) {
            throw new InvalidArgumentException("Can only merge with another sentence index, got null");
        }
        MergeOptions effective = options == null ? MergeOptions.defaults() : options;

        // Taken before appending so merging an index into itself terminates.
        List<String> incoming = source.snapshot();
        int offset = target.size();

        // Duplicates are judged against the collection as it was before this merge.
        int appended = 0;
        for (String sentence : incoming) {
            if (effective.deduplicate() && isPreexisting(target, sentence, offset)) {
                continue;
            }
            target.append(sentence);
            appended++;
        }
        // also when every sentence was skipped
        target.suggestions().invalidate();
        return new MergeReport(incoming.size(), appended, incoming.size() - appended, offset);
    }

    private static boolean isPreexisting(SentenceIndex target, String sentence, int offset) {
        return target.indexOf(sentence).orElse(Integer.MAX_VALUE) < offset;
    }
}
