package com.starscape.gallery.features.pagesbuild.domain;

/**
 * Terminal result of a build watch.
 *
 * @param status SUCCEEDED, FAILED or TIMED_OUT
 * @param url published site URL on success, otherwise null
 * @param message human readable reason
 * @param attempts number of polls performed
 */
public record BuildOutcome(
    BuildStatus status,
    String url,
    String message,
    int attempts
) {

    public BuildOutcome {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Outcome status must be terminal: " + status);
        }
    }

    public static BuildOutcome succeeded(String url, int attempts) {
        return new BuildOutcome(BuildStatus.SUCCEEDED, url, "Site is live", attempts);
    }

    public static BuildOutcome failed(String message, int attempts) {
        return new BuildOutcome(BuildStatus.FAILED, null, message, attempts);
    }

    public static BuildOutcome timedOut(int attempts) {
        return new BuildOutcome(BuildStatus.TIMED_OUT, null,
            "Build status check timed out after " + attempts + " attempts", attempts);
    }

    public boolean isSuccess() {
        return status == BuildStatus.SUCCEEDED;
    }
}
