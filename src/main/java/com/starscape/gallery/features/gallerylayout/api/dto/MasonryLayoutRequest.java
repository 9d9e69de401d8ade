package com.starscape.gallery.features.gallerylayout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record MasonryLayoutRequest(
    @NotNull(message = "Items list is required")
    @Valid
    List<LayoutItemRequest> items,

    @Positive(message = "Width must be positive")
    int width,

    @PositiveOrZero(message = "Spacing cannot be negative")
    Integer spacing,

    @Positive(message = "Columns must be positive")
    @Max(value = 50, message = "Maximum 50 columns")
    Integer columns
) {}
