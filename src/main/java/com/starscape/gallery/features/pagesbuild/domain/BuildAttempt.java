package com.starscape.gallery.features.pagesbuild.domain;

import java.time.Instant;

/**
 * One poll of the build status endpoint.
 */
public record BuildAttempt(
    int attempt,
    BuildStatus status,
    String message,
    Instant observedAt
) {
}
