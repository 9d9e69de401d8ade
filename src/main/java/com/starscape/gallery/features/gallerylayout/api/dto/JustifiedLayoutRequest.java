package com.starscape.gallery.features.gallerylayout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Spacing and row height fall back to the configured defaults when omitted.
 */
public record JustifiedLayoutRequest(
    @NotNull(message = "Items list is required")
    @Valid
    List<LayoutItemRequest> items,

    @Positive(message = "Width must be positive")
    int width,

    @PositiveOrZero(message = "Spacing cannot be negative")
    Integer spacing,

    @Positive(message = "Row height must be positive")
    Integer rowHeight
) {}
