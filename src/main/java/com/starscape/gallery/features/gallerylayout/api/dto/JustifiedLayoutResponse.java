package com.starscape.gallery.features.gallerylayout.api.dto;

import java.util.List;

/**
 * Rows in top to bottom order; each row lists its tiles left to right.
 */
public record JustifiedLayoutResponse(
    int totalHeight,
    List<List<TilePlacement>> rows
) {}
