package com.starscape.gallery.features.ratelimit.api.dto;

import java.time.Instant;

/**
 * Remaining and reset are null until the first API response has been observed.
 */
public record RateLimitResponse(
    String level,
    Integer remaining,
    Instant resetAt,
    Instant observedAt
) {}
