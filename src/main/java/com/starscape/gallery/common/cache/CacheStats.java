package com.starscape.gallery.common.cache;

public record CacheStats(
    int totalItems,
    int validItems,
    int expiredItems,
    int maxSize,
    boolean enabled
) {}
