package io.sentex.index;

/**
 * @param deduplicate skip source sentences whose exact text is already in
 *                    the receiving collection
 */
public record MergeOptions(boolean deduplicate) {

    private static final MergeOptions DEFAULTS = new MergeOptions(false);
    private static final MergeOptions DEDUPLICATING = new MergeOptions(true);

    public static MergeOptions defaults() {
        return DEFAULTS;
    }

    public static MergeOptions deduplicating() {
        return DEDUPLICATING;
    }
}
