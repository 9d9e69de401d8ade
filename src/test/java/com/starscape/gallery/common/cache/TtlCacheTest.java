package com.starscape.gallery.common.cache;

import com.starscape.gallery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        cache = new TtlCache<>(clock, Duration.ofMinutes(5), 3, true);
    }

    @Test
    @DisplayName("Value is readable until its TTL passes, then it is gone and purged")
    void expiresAfterTtl() {
        cache.put("k", "v", Duration.ofSeconds(1));
        assertEquals("v", cache.get("k").orElseThrow());

        clock.advance(Duration.ofMillis(1000));
        assertTrue(cache.get("k").isPresent(), "Entry is still valid exactly at its expiry instant");

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size(), "Expired entry must be removed on read");
    }

    @Test
    @DisplayName("Inserting max + 1 keys evicts the earliest inserted key")
    void evictsOldestWhenFull() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(1));
        cache.put("b", "2");
        clock.advance(Duration.ofSeconds(1));
        cache.put("c", "3");
        clock.advance(Duration.ofSeconds(1));
        cache.put("d", "4");

        assertEquals(3, cache.size());
        assertFalse(cache.containsKey("a"));
        assertTrue(cache.containsKey("b"));
        assertTrue(cache.containsKey("d"));
    }

    @Test
    @DisplayName("Entries created at the same instant evict in insertion order")
    void evictsInInsertionOrderOnTies() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.put("d", "4");

        assertFalse(cache.containsKey("a"));
        assertEquals(List.of(true, true, true),
            List.of(cache.containsKey("b"), cache.containsKey("c"), cache.containsKey("d")));
    }

    @Test
    @DisplayName("Expired entries are evicted before live ones")
    void evictsExpiredFirst() {
        cache.put("old", "1");
        cache.put("short", "2", Duration.ofSeconds(1));
        cache.put("other", "3");
        clock.advance(Duration.ofSeconds(2));

        cache.put("new", "4");

        assertEquals(3, cache.size());
        assertFalse(cache.containsKey("short"));
        assertTrue(cache.containsKey("old"), "Live entry must survive when an expired one can go");
    }

    @Test
    @DisplayName("Overwriting a key replaces the value and refreshes its age")
    void overwriteRefreshesEntry() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(1));
        cache.put("b", "2");
        clock.advance(Duration.ofSeconds(1));
        cache.put("a", "updated");
        clock.advance(Duration.ofSeconds(1));
        cache.put("c", "3");
        cache.put("d", "4");

        assertEquals("updated", cache.get("a").orElseThrow());
        assertFalse(cache.containsKey("b"));
    }

    @Test
    @DisplayName("Disabled cache never stores and never hits")
    void disabledCacheIsTransparent() {
        TtlCache<String> disabled = new TtlCache<>(clock, Duration.ofMinutes(5), 3, false);
        disabled.put("k", "v");

        assertTrue(disabled.get("k").isEmpty());
        assertEquals(0, disabled.size());
        assertFalse(disabled.stats().enabled());
    }

    @Test
    void deleteAndClearAreIdempotent() {
        cache.put("k", "v");

        assertTrue(cache.delete("k"));
        assertFalse(cache.delete("k"));

        cache.put("x", "y");
        cache.clear();
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void invalidateIfRemovesMatchingKeysOnly() {
        cache.put("thumbnails:a:1", "1");
        cache.put("thumbnails:b:1", "2");
        cache.put("repo_list", "3");

        int removed = cache.invalidateIf(key -> key.startsWith("thumbnails:a:"));

        assertEquals(1, removed);
        assertTrue(cache.containsKey("thumbnails:b:1"));
        assertTrue(cache.containsKey("repo_list"));
    }

    @Test
    void statsCountExpiredEntries() {
        cache.put("a", "1", Duration.ofSeconds(1));
        cache.put("b", "2");
        clock.advance(Duration.ofSeconds(5));

        CacheStats stats = cache.stats();

        assertEquals(2, stats.totalItems());
        assertEquals(1, stats.validItems());
        assertEquals(1, stats.expiredItems());
        assertEquals(3, stats.maxSize());
        assertTrue(stats.enabled());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<>(clock, Duration.ofSeconds(1), 0, true));
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<>(clock, Duration.ofSeconds(-1), 10, true));
    }

    @Test
    @DisplayName("Concurrent writers never push the store over its maximum size")
    void concurrentPutsRespectMaxSize() throws InterruptedException {
        TtlCache<Integer> shared = new TtlCache<>(clock, Duration.ofMinutes(5), 50, true);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        List<Throwable> errors = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int thread = t;
            executor.execute(() -> {
                try {
                    for (int i = 0; i < 200; i++) {
                        shared.put(thread + ":" + i, i);
                        shared.get(thread + ":" + (i / 2));
                    }
                } catch (Throwable e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertTrue(errors.isEmpty(), () -> "Unexpected errors: " + errors);
        assertEquals(50, shared.size());
    }
}
