package com.starscape.gallery.features.ratelimit.app;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.ratelimit.domain.RateLimitLevel;
import com.starscape.gallery.features.ratelimit.domain.RateLimitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the hosting API's remaining quota from response headers and classifies urgency.
 *
 * The tracker is observational: it never blocks or throttles a request, it only reports
 * the level so callers can decide what to do. The snapshot is a single process-wide value
 * and the last request to finish wins.
 */
@Component
public class RateLimitTracker {

    private static final Logger log = LoggerFactory.getLogger(RateLimitTracker.class);

    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final AtomicReference<RateLimitSnapshot> snapshot = new AtomicReference<>();
    private final Clock clock;
    private final int warningThreshold;
    private final int criticalThreshold;

    @Autowired
    public RateLimitTracker(Clock clock, GalleryProperties properties) {
        this(clock, properties.getRateLimit().getWarningThreshold(), properties.getRateLimit().getCriticalThreshold());
    }

    public RateLimitTracker(Clock clock, int warningThreshold, int criticalThreshold) {
        if (criticalThreshold > warningThreshold) {
            throw new IllegalArgumentException("Critical threshold must not exceed warning threshold");
        }
        this.clock = clock;
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
    }

    /**
     * Record quota information from a response. Responses without rate limit headers
     * (raw file downloads, for instance) leave the current snapshot untouched.
     */
    public void record(HttpHeaders headers) {
        String remaining = headers.getFirst(REMAINING_HEADER);
        if (remaining == null) {
            return;
        }
        try {
            String reset = headers.getFirst(RESET_HEADER);
            int parsedRemaining = Integer.parseInt(remaining.trim());
            if (reset != null) {
                record(parsedRemaining, Instant.ofEpochSecond(Long.parseLong(reset.trim())));
            } else {
                // a response without a reset header keeps the last known reset instant
                RateLimitSnapshot previous = snapshot.get();
                record(parsedRemaining, previous != null ? previous.resetAt() : null);
            }
        } catch (IllegalArgumentException e) {
            log.error("Error checking rate limit: {}", e.getMessage());
        }
    }

    public RateLimitSnapshot record(int remaining, long resetEpochSeconds) {
        return record(remaining, Instant.ofEpochSecond(resetEpochSeconds));
    }

    private RateLimitSnapshot record(int remaining, Instant resetAt) {
        RateLimitSnapshot update = new RateLimitSnapshot(remaining, resetAt, clock.instant());
        snapshot.set(update);

        RateLimitLevel level = classify(remaining);
        if (level == RateLimitLevel.CRITICAL) {
            log.warn("Critical rate limit: {} remaining, resets at {}", remaining, update.resetAt());
        } else if (level == RateLimitLevel.WARNING) {
            log.warn("Rate limit warning: {} remaining", remaining);
        }
        return update;
    }

    public Optional<RateLimitSnapshot> current() {
        return Optional.ofNullable(snapshot.get());
    }

    public RateLimitLevel level() {
        RateLimitSnapshot current = snapshot.get();
        return current == null ? RateLimitLevel.UNKNOWN : classify(current.remaining());
    }

    public RateLimitLevel classify(int remaining) {
        if (remaining < criticalThreshold) {
            return RateLimitLevel.CRITICAL;
        }
        if (remaining < warningThreshold) {
            return RateLimitLevel.WARNING;
        }
        return RateLimitLevel.OK;
    }
}
