package com.starscape.gallery.features.ratelimit.domain;

public enum RateLimitLevel {
    UNKNOWN,
    OK,
    WARNING,
    CRITICAL
}
