package com.starscape.gallery.features.gallerylayout.domain;

import java.util.List;

/**
 * One horizontal strip of the justified layout.
 *
 * @param scaled false for the trailing partial row, which keeps natural widths
 */
public record Row<T extends LayoutItem>(
    List<Placement<T>> placements,
    int top,
    int height,
    boolean scaled
) {

    public Row {
        placements = List.copyOf(placements);
    }

    /**
     * Sum of item widths plus the spacing between them.
     */
    public int width(int spacing) {
        int total = placements.stream().mapToInt(Placement::width).sum();
        return total + spacing * Math.max(0, placements.size() - 1);
    }
}
