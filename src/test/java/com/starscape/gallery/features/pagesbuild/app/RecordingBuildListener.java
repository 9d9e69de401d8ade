package com.starscape.gallery.features.pagesbuild.app;

import com.starscape.gallery.features.pagesbuild.domain.BuildAttempt;
import com.starscape.gallery.features.pagesbuild.domain.BuildOutcome;
import com.starscape.gallery.features.pagesbuild.domain.BuildStatus;
import com.starscape.gallery.features.pagesbuild.domain.BuildStatusListener;

import java.util.ArrayList;
import java.util.List;

class RecordingBuildListener implements BuildStatusListener {

    private final List<BuildAttempt> attempts = new ArrayList<>();
    private final List<BuildOutcome> outcomes = new ArrayList<>();

    @Override
    public synchronized void onStatusChanged(String repository, BuildAttempt attempt) {
        attempts.add(attempt);
    }

    @Override
    public synchronized void onCompleted(String repository, BuildOutcome outcome) {
        outcomes.add(outcome);
    }

    synchronized List<BuildStatus> statuses() {
        return attempts.stream().map(BuildAttempt::status).toList();
    }

    synchronized List<BuildAttempt> attempts() {
        return List.copyOf(attempts);
    }

    synchronized List<BuildOutcome> outcomes() {
        return List.copyOf(outcomes);
    }
}
