package io.sentex.index;

/**
 * Outcome of a merge.
 *
 * @param sourceCount sentences in the source collection
 * @param appended    sentences appended to the receiving collection
 * @param skipped     source sentences dropped as duplicates
 * @param offset      position of the first appended sentence
 */
public record MergeReport(int sourceCount, int appended, int skipped, int offset) {

    public MergeReport {
        if (appended + skipped != sourceCount) {
            throw new IllegalArgumentException("appended + skipped must equal sourceCount");
        }
    }
}
