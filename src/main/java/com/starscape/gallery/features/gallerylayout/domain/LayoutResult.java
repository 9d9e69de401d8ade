package com.starscape.gallery.features.gallerylayout.domain;

import java.util.List;

/**
 * Output of a justified layout pass: rows in top to bottom order and the content height the
 * scroll viewport needs.
 */
public record LayoutResult<T extends LayoutItem>(
    List<Row<T>> rows,
    int totalHeight
) {

    public LayoutResult {
        rows = List.copyOf(rows);
    }

    public static <T extends LayoutItem> LayoutResult<T> empty() {
        return new LayoutResult<>(List.of(), 0);
    }

    public List<Placement<T>> placements() {
        return rows.stream()
                .flatMap(row -> row.placements().stream())
                .toList();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
