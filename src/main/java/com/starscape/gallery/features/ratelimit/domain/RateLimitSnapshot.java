package com.starscape.gallery.features.ratelimit.domain;

import java.time.Instant;

/**
 * Remaining API quota as reported by the most recently completed request.
 * {@code resetAt} is null until a response has carried a reset header.
 */
public record RateLimitSnapshot(
    int remaining,
    Instant resetAt,
    Instant observedAt
) {

    public RateLimitSnapshot {
        if (remaining < 0) {
            throw new IllegalArgumentException("Remaining quota cannot be negative");
        }
    }
}
