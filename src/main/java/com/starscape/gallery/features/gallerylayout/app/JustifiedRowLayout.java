package com.starscape.gallery.features.gallerylayout.app;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.gallerylayout.domain.LayoutItem;
import com.starscape.gallery.features.gallerylayout.domain.LayoutResult;
import com.starscape.gallery.features.gallerylayout.domain.Placement;
import com.starscape.gallery.features.gallerylayout.domain.Row;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs items into fixed-height rows whose items are scaled as a group to fill the
 * container width exactly.
 *
 * Items are taken in order. Each has a natural width of {@code round(rowHeight * aspect)}.
 * Once the natural widths plus spacing of the candidate row exceed the container width and
 * the row holds at least two items, the row is closed and scaled uniformly. A single item
 * wider than the container is never stretched or shrunk on its own. The trailing partial
 * row keeps natural widths.
 *
 * Widths are rounded independently per item, so a scaled row may end a few pixels short
 * of or past the container edge (at most one pixel per item boundary).
 *
 * The layout keeps no state between calls; every resize or content change recomputes the
 * whole gallery. Invalid geometry yields an empty result instead of an exception since
 * reflows are triggered opportunistically during resize transients.
 */
@Component
public class JustifiedRowLayout {

    private final int defaultRowHeight;
    private final int defaultSpacing;

    @Autowired
    public JustifiedRowLayout(GalleryProperties properties) {
        this(properties.getLayout().getRowHeight(), properties.getLayout().getSpacing());
    }

    public JustifiedRowLayout(int defaultRowHeight, int defaultSpacing) {
        this.defaultRowHeight = defaultRowHeight;
        this.defaultSpacing = defaultSpacing;
    }

    public <T extends LayoutItem> LayoutResult<T> layout(List<T> items, int containerWidth) {
        return layout(items, containerWidth, defaultSpacing, defaultRowHeight);
    }

    public <T extends LayoutItem> LayoutResult<T> layout(List<T> items, int containerWidth, int spacing, int rowHeight) {
        if (items == null || items.isEmpty() || containerWidth <= 0 || spacing < 0 || rowHeight <= 0) {
            return LayoutResult.empty();
        }

        List<Row<T>> rows = new ArrayList<>();
        List<Candidate<T>> candidate = new ArrayList<>();
        long accumulatedWidth = 0;
        int y = 0;

        for (int index = 0; index < items.size(); index++) {
            T item = items.get(index);
            int naturalWidth = LayoutItem.toPixels(rowHeight * LayoutItem.effectiveAspectRatio(item));
            candidate.add(new Candidate<>(item, index, naturalWidth));
            accumulatedWidth += naturalWidth + spacing;

            if (accumulatedWidth - spacing > containerWidth && candidate.size() > 1) {
                rows.add(scaledRow(candidate, containerWidth, spacing, rowHeight, y));
                y += rowHeight + spacing;
                candidate.clear();
                accumulatedWidth = 0;
            }
        }

        int totalHeight;
        if (!candidate.isEmpty()) {
            rows.add(naturalRow(candidate, spacing, rowHeight, y));
            totalHeight = y + rowHeight;
        } else {
            // y already points past the last full row's trailing spacing
            totalHeight = y - spacing;
        }

        return new LayoutResult<>(rows, totalHeight);
    }

    public int getDefaultRowHeight() {
        return defaultRowHeight;
    }

    public int getDefaultSpacing() {
        return defaultSpacing;
    }

    private <T extends LayoutItem> Row<T> scaledRow(
            List<Candidate<T>> candidate, int containerWidth, int spacing, int rowHeight, int y) {
        long naturalTotal = candidate.stream().mapToLong(Candidate::naturalWidth).sum();
        double scale = (containerWidth - (double) spacing * (candidate.size() - 1)) / naturalTotal;

        List<Placement<T>> placements = new ArrayList<>(candidate.size());
        int x = 0;
        for (Candidate<T> c : candidate) {
            int width = Math.max(0, (int) Math.round(c.naturalWidth() * scale));
            placements.add(new Placement<>(c.item(), c.index(), x, y, width, rowHeight));
            x += width + spacing;
        }
        return new Row<>(placements, y, rowHeight, true);
    }

    private <T extends LayoutItem> Row<T> naturalRow(List<Candidate<T>> candidate, int spacing, int rowHeight, int y) {
        List<Placement<T>> placements = new ArrayList<>(candidate.size());
        int x = 0;
        for (Candidate<T> c : candidate) {
            placements.add(new Placement<>(c.item(), c.index(), x, y, c.naturalWidth(), rowHeight));
            x += c.naturalWidth() + spacing;
        }
        return new Row<>(placements, y, rowHeight, false);
    }

    private record Candidate<T extends LayoutItem>(T item, int index, int naturalWidth) {}
}
