package com.starscape.gallery.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory key-value store whose entries expire after a time-to-live.
 *
 * Expired entries are treated as absent and removed lazily on read. When an insertion
 * pushes the store over its maximum size, expired entries are purged first and then the
 * oldest entries (by creation time, not last access) are evicted until the store is back
 * at its maximum size.
 *
 * When the cache is disabled every lookup misses and every insertion is dropped, so call
 * sites never need to check the switch themselves.
 *
 * All operations are synchronized; the store is shared by request threads and fetch workers.
 */
public class TtlCache<V> {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    // insertion ordered so that entries created at the same instant evict first-in first-out
    private final Map<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxSize;
    private final boolean enabled;

    public TtlCache(Clock clock, Duration defaultTtl, int maxSize, boolean enabled) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache max size must be positive");
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Cache default TTL must not be negative");
        }
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
        this.enabled = enabled;
    }

    public synchronized Optional<V> get(String key) {
        if (!enabled) {
            return Optional.empty();
        }

        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            log.debug("Cache item expired: {}", key);
            return Optional.empty();
        }

        log.debug("Cache hit: {}", key);
        return Optional.ofNullable(entry.value());
    }

    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    public synchronized void put(String key, V value, Duration ttl) {
        if (!enabled) {
            return;
        }

        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        Instant now = clock.instant();

        // re-insert so an overwritten key moves to the young end of the eviction order
        entries.remove(key);
        entries.put(key, new CacheEntry<>(value, now, now.plus(effectiveTtl)));

        if (entries.size() > maxSize) {
            evict(now);
        }

        log.debug("Cache set: {} (TTL: {}s)", key, effectiveTtl.toSeconds());
    }

    public synchronized boolean delete(String key) {
        boolean removed = entries.remove(key) != null;
        if (removed) {
            log.debug("Cache deleted: {}", key);
        }
        return removed;
    }

    /**
     * Remove every entry whose key matches the predicate, expired or not.
     * @return the number of entries removed
     */
    public synchronized int invalidateIf(Predicate<String> keyPredicate) {
        int before = entries.size();
        entries.keySet().removeIf(keyPredicate);
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        log.debug("Cache cleared");
    }

    /**
     * Physical number of stored entries, including expired ones not yet purged.
     */
    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public synchronized CacheStats stats() {
        Instant now = clock.instant();
        int expired = (int) entries.values().stream()
                .filter(entry -> entry.isExpired(now))
                .count();
        int total = entries.size();
        return new CacheStats(total, total - expired, expired, maxSize, enabled);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getMaxSize() {
        return maxSize;
    }

    private void evict(Instant now) {
        int expired = invalidateExpired(now);

        int evicted = 0;
        if (entries.size() > maxSize) {
            List<Map.Entry<String, CacheEntry<V>>> byAge = new ArrayList<>(entries.entrySet());
            // stable sort keeps insertion order for identical creation instants
            byAge.sort(Comparator.comparing(e -> e.getValue().createdAt()));

            int toRemove = entries.size() - maxSize;
            List<String> victims = new ArrayList<>(toRemove);
            for (int i = 0; i < toRemove; i++) {
                victims.add(byAge.get(i).getKey());
            }
            victims.forEach(entries::remove);
            evicted = victims.size();
        }

        log.debug("Cache cleanup completed: expired={}, evicted={}, items={}", expired, evicted, entries.size());
    }

    private int invalidateExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }
}
