package com.starscape.gallery.features.thumbnails.domain;

/**
 * Receives thumbnail completions. Calls arrive on worker threads, in completion order
 * rather than submission order; use {@link FetchResult#index()} to place results.
 */
public interface FetchListener {

    void onItemLoaded(FetchResult result);

    /**
     * Called exactly once per batch, after every item has been accounted for.
     */
    void onFinished(FetchSummary summary);
}
