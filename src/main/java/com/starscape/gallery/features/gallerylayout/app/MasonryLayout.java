package com.starscape.gallery.features.gallerylayout.app;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.gallerylayout.domain.LayoutItem;
import com.starscape.gallery.features.gallerylayout.domain.MasonryResult;
import com.starscape.gallery.features.gallerylayout.domain.Placement;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width columns; each item drops into the currently shortest column.
 */
@Component
public class MasonryLayout {

    private final int defaultColumns;
    private final int defaultSpacing;

    @Autowired
    public MasonryLayout(GalleryProperties properties) {
        this(properties.getLayout().getMasonryColumns(), properties.getLayout().getSpacing());
    }

    public MasonryLayout(int defaultColumns, int defaultSpacing) {
        this.defaultColumns = defaultColumns;
        this.defaultSpacing = defaultSpacing;
    }

    public <T extends LayoutItem> MasonryResult<T> layout(List<T> items, int containerWidth) {
        return layout(items, containerWidth, defaultSpacing, defaultColumns);
    }

    public <T extends LayoutItem> MasonryResult<T> layout(List<T> items, int containerWidth, int spacing, int columns) {
        if (items == null || items.isEmpty() || containerWidth <= 0 || spacing < 0 || columns <= 0) {
            return MasonryResult.empty();
        }

        int columnWidth = (containerWidth - (columns - 1) * spacing) / columns;
        if (columnWidth <= 0) {
            return MasonryResult.empty();
        }

        int[] offsets = new int[columns];
        List<Placement<T>> placements = new ArrayList<>(items.size());
        for (int index = 0; index < items.size(); index++) {
            T item = items.get(index);
            int height = LayoutItem.toPixels(columnWidth / LayoutItem.effectiveAspectRatio(item));
            int column = shortestColumn(offsets);
            int x = column * (columnWidth + spacing);
            placements.add(new Placement<>(item, index, x, offsets[column], columnWidth, height));
            // saturates instead of wrapping for absurdly tall items
            offsets[column] = (int) Math.min(Integer.MAX_VALUE, (long) offsets[column] + height + spacing);
        }

        int totalHeight = 0;
        for (int offset : offsets) {
            // offsets carry a trailing spacing for every non-empty column
            totalHeight = Math.max(totalHeight, offset > 0 ? offset - spacing : 0);
        }
        return new MasonryResult<>(placements, columnWidth, totalHeight);
    }

    public int getDefaultColumns() {
        return defaultColumns;
    }

    public int getDefaultSpacing() {
        return defaultSpacing;
    }

    private static int shortestColumn(int[] offsets) {
        int shortest = 0;
        for (int column = 1; column < offsets.length; column++) {
            if (offsets[column] < offsets[shortest]) {
                shortest = column;
            }
        }
        return shortest;
    }
}
