package com.starscape.gallery.features.repositories.api.dto;

import java.util.List;

/**
 * Justified gallery of a repository's thumbnails.
 */
public record GalleryResponse(
    String repository,
    int width,
    int totalHeight,
    int loadedCount,
    int failedCount,
    List<GalleryTile> tiles
) {
    public static GalleryResponse empty(String repository, int width) {
        return new GalleryResponse(repository, width, 0, 0, 0, List.of());
    }
}
