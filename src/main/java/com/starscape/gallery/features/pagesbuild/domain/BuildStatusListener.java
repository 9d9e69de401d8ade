package com.starscape.gallery.features.pagesbuild.domain;

/**
 * Receives the events of one build watch, in attempt order, from the poller thread.
 */
public interface BuildStatusListener {

    /**
     * Called when a poll observes a non-terminal status different from the previous one.
     */
    void onStatusChanged(String repository, BuildAttempt attempt);

    /**
     * Called exactly once when the watch ends on its own. Never called after a cancel.
     */
    void onCompleted(String repository, BuildOutcome outcome);
}
