package com.starscape.gallery.features.thumbnails.domain;

/**
 * Accounting for a finished batch: every submitted item is loaded, failed or skipped.
 */
public record FetchSummary(
    int total,
    int loaded,
    int failed,
    int skipped,
    boolean cancelled
) {}
