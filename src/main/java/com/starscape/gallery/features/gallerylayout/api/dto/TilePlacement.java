package com.starscape.gallery.features.gallerylayout.api.dto;

import com.starscape.gallery.features.gallerylayout.domain.Placement;

public record TilePlacement(
    String id,
    int index,
    int x,
    int y,
    int width,
    int height
) {
    public static TilePlacement from(Placement<LayoutItemRequest> placement) {
        return new TilePlacement(
            placement.item().id(),
            placement.index(),
            placement.x(),
            placement.y(),
            placement.width(),
            placement.height()
        );
    }
}
