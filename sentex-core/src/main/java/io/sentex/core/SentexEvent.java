package io.sentex.core;

/**
 * Lifecycle events fired by a sentence finder.
 */
public enum SentexEvent {
    /**
     * Collection replaced. Payload: resulting sentence count.
     */
    INIT(true),

    /**
     * Search finished. Payload: result count.
     */
    SEARCH(true),

    /**
     * Suggestion lookup finished. Payload: suggestion count.
     */
    SUGGEST(true),

    /**
     * Another finder merged in. Payload: sentence count of the source finder.
     */
    MERGE(true),

    /**
     * Collection cleared. No payload.
     */
    RESET(false);

    private final boolean carriesCount;

    SentexEvent(boolean carriesCount) {
        this.carriesCount = carriesCount;
    }

    public boolean carriesCount() {
        return carriesCount;
    }
}
