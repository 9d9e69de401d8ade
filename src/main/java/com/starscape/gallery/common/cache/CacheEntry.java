package com.starscape.gallery.common.cache;

import java.time.Instant;

/**
 * A cached value with its creation and absolute expiration instants.
 */
public record CacheEntry<V>(
    V value,
    Instant createdAt,
    Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
