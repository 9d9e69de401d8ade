package com.starscape.gallery.features.pagesbuild.api.dto;

import java.time.Instant;

/**
 * Build watch event for WebSocket broadcasts.
 * Sent on every status change and once more when the watch completes.
 */
public record BuildStatusUpdate(
    String repository,
    String status,
    String message,
    int attempt,
    String url,
    boolean terminal,
    Instant timestamp
) {
}
