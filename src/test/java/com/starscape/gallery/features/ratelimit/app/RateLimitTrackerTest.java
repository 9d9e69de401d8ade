package com.starscape.gallery.features.ratelimit.app;

import com.starscape.gallery.features.ratelimit.domain.RateLimitLevel;
import com.starscape.gallery.features.ratelimit.domain.RateLimitSnapshot;
import com.starscape.gallery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitTrackerTest {

    private MutableClock clock;
    private RateLimitTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        tracker = new RateLimitTracker(clock, 100, 10);
    }

    @Test
    void levelIsUnknownBeforeAnyResponse() {
        assertEquals(RateLimitLevel.UNKNOWN, tracker.level());
        assertTrue(tracker.current().isEmpty());
    }

    @Test
    @DisplayName("Levels switch strictly below each threshold")
    void classifiesAgainstThresholds() {
        assertEquals(RateLimitLevel.OK, tracker.classify(100));
        assertEquals(RateLimitLevel.WARNING, tracker.classify(99));
        assertEquals(RateLimitLevel.WARNING, tracker.classify(10));
        assertEquals(RateLimitLevel.CRITICAL, tracker.classify(9));
        assertEquals(RateLimitLevel.CRITICAL, tracker.classify(0));
    }

    @Test
    void recordsSnapshotFromHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(RateLimitTracker.REMAINING_HEADER, "42");
        headers.add(RateLimitTracker.RESET_HEADER, "1714560000");

        tracker.record(headers);

        RateLimitSnapshot snapshot = tracker.current().orElseThrow();
        assertEquals(42, snapshot.remaining());
        assertEquals(Instant.ofEpochSecond(1714560000L), snapshot.resetAt());
        assertEquals(clock.instant(), snapshot.observedAt());
        assertEquals(RateLimitLevel.WARNING, tracker.level());
    }

    @Test
    @DisplayName("Responses without quota headers leave the last snapshot in place")
    void missingHeadersAreIgnored() {
        tracker.record(3000, 1714560000L);

        tracker.record(new HttpHeaders());

        assertEquals(3000, tracker.current().orElseThrow().remaining());
        assertEquals(RateLimitLevel.OK, tracker.level());
    }

    @Test
    @DisplayName("A missing reset header keeps the last known reset instant")
    void missingResetKeepsPreviousInstant() {
        HttpHeaders remainingOnly = new HttpHeaders();
        remainingOnly.add(RateLimitTracker.REMAINING_HEADER, "41");

        tracker.record(remainingOnly);
        assertNull(tracker.current().orElseThrow().resetAt());

        tracker.record(50, 1714560000L);
        tracker.record(remainingOnly);

        RateLimitSnapshot snapshot = tracker.current().orElseThrow();
        assertEquals(41, snapshot.remaining());
        assertEquals(Instant.ofEpochSecond(1714560000L), snapshot.resetAt());
    }

    @Test
    void malformedHeadersAreIgnored() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(RateLimitTracker.REMAINING_HEADER, "plenty");

        tracker.record(headers);

        assertTrue(tracker.current().isEmpty());
    }

    @Test
    void lastWriteWins() {
        tracker.record(5, 1L);
        tracker.record(4000, 2L);

        assertEquals(4000, tracker.current().orElseThrow().remaining());
        assertEquals(RateLimitLevel.OK, tracker.level());
    }

    @Test
    void rejectsCriticalAboveWarning() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitTracker(clock, 10, 100));
    }
}
