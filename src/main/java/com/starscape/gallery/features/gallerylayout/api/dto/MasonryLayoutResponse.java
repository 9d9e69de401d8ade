package com.starscape.gallery.features.gallerylayout.api.dto;

import java.util.List;

public record MasonryLayoutResponse(
    int columnWidth,
    int totalHeight,
    List<TilePlacement> tiles
) {}
