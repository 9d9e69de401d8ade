package com.starscape.gallery.features.pagesbuild.domain;

/**
 * Observed state of a Pages build.
 */
public enum BuildStatus {
    NOT_STARTED,
    BUILDING,
    SUCCEEDED,
    FAILED,
    UNKNOWN,
    TIMED_OUT;

    /**
     * Map the status string reported by the hosting API.
     */
    public static BuildStatus fromRemote(String remote) {
        if (remote == null) {
            return UNKNOWN;
        }
        return switch (remote) {
            case "built" -> SUCCEEDED;
            case "building" -> BUILDING;
            case "errored" -> FAILED;
            case "not_built" -> NOT_STARTED;
            default -> UNKNOWN;
        };
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
