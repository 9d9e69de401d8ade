package com.starscape.gallery.features.ratelimit.api;

import com.starscape.gallery.features.ratelimit.api.dto.RateLimitResponse;
import com.starscape.gallery.features.ratelimit.app.RateLimitTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rate-limit")
public class RateLimitController {

    private final RateLimitTracker rateLimitTracker;

    public RateLimitController(RateLimitTracker rateLimitTracker) {
        this.rateLimitTracker = rateLimitTracker;
    }

    @GetMapping
    public ResponseEntity<RateLimitResponse> current() {
        String level = rateLimitTracker.level().name();
        RateLimitResponse response = rateLimitTracker.current()
                .map(snapshot -> new RateLimitResponse(level, snapshot.remaining(), snapshot.resetAt(), snapshot.observedAt()))
                .orElseGet(() -> new RateLimitResponse(level, null, null, null));
        return ResponseEntity.ok(response);
    }
}
