package com.starscape.gallery.features.gallerylayout.api.dto;

import com.starscape.gallery.features.gallerylayout.domain.LayoutItem;
import jakarta.validation.constraints.NotBlank;

public record LayoutItemRequest(
    @NotBlank(message = "Item id is required")
    String id,

    double aspectRatio
) implements LayoutItem {}
