package com.starscape.gallery.features.gallerylayout.domain;

import java.util.List;

/**
 * Output of a masonry pass. Placements are in input order.
 */
public record MasonryResult<T extends LayoutItem>(
    List<Placement<T>> placements,
    int columnWidth,
    int totalHeight
) {

    public MasonryResult {
        placements = List.copyOf(placements);
    }

    public static <T extends LayoutItem> MasonryResult<T> empty() {
        return new MasonryResult<>(List.of(), 0, 0);
    }
}
