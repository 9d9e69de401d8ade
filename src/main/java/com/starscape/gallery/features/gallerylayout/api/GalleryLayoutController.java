package com.starscape.gallery.features.gallerylayout.api;

import com.starscape.gallery.features.gallerylayout.api.dto.JustifiedLayoutRequest;
import com.starscape.gallery.features.gallerylayout.api.dto.JustifiedLayoutResponse;
import com.starscape.gallery.features.gallerylayout.api.dto.LayoutItemRequest;
import com.starscape.gallery.features.gallerylayout.api.dto.MasonryLayoutRequest;
import com.starscape.gallery.features.gallerylayout.api.dto.MasonryLayoutResponse;
import com.starscape.gallery.features.gallerylayout.api.dto.TilePlacement;
import com.starscape.gallery.features.gallerylayout.app.JustifiedRowLayout;
import com.starscape.gallery.features.gallerylayout.app.MasonryLayout;
import com.starscape.gallery.features.gallerylayout.domain.LayoutResult;
import com.starscape.gallery.features.gallerylayout.domain.MasonryResult;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Stateless layout over caller-supplied aspect ratios.
 */
@RestController
@RequestMapping("/api/layout")
public class GalleryLayoutController {

    private final JustifiedRowLayout justifiedRowLayout;
    private final MasonryLayout masonryLayout;

    public GalleryLayoutController(JustifiedRowLayout justifiedRowLayout, MasonryLayout masonryLayout) {
        this.justifiedRowLayout = justifiedRowLayout;
        this.masonryLayout = masonryLayout;
    }

    @PostMapping("/justified")
    public ResponseEntity<JustifiedLayoutResponse> justified(@Valid @RequestBody JustifiedLayoutRequest request) {
        int spacing = request.spacing() != null ? request.spacing() : justifiedRowLayout.getDefaultSpacing();
        int rowHeight = request.rowHeight() != null ? request.rowHeight() : justifiedRowLayout.getDefaultRowHeight();

        LayoutResult<LayoutItemRequest> result =
            justifiedRowLayout.layout(request.items(), request.width(), spacing, rowHeight);

        List<List<TilePlacement>> rows = result.rows().stream()
                .map(row -> row.placements().stream().map(TilePlacement::from).toList())
                .toList();
        return ResponseEntity.ok(new JustifiedLayoutResponse(result.totalHeight(), rows));
    }

    @PostMapping("/masonry")
    public ResponseEntity<MasonryLayoutResponse> masonry(@Valid @RequestBody MasonryLayoutRequest request) {
        int spacing = request.spacing() != null ? request.spacing() : masonryLayout.getDefaultSpacing();
        int columns = request.columns() != null ? request.columns() : masonryLayout.getDefaultColumns();

        MasonryResult<LayoutItemRequest> result =
            masonryLayout.layout(request.items(), request.width(), spacing, columns);

        List<TilePlacement> tiles = result.placements().stream().map(TilePlacement::from).toList();
        return ResponseEntity.ok(new MasonryLayoutResponse(result.columnWidth(), result.totalHeight(), tiles));
    }
}
