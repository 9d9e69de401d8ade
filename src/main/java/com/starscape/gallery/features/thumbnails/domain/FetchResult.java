package com.starscape.gallery.features.thumbnails.domain;

import java.awt.image.BufferedImage;

/**
 * Completion of one item. {@code thumbnail} is null when the item failed.
 *
 * @param index position of the item in the submitted batch
 */
public record FetchResult(
    int index,
    String name,
    BufferedImage thumbnail,
    String error
) {

    public static FetchResult loaded(int index, String name, BufferedImage thumbnail) {
        return new FetchResult(index, name, thumbnail, null);
    }

    public static FetchResult failed(int index, String name, String error) {
        return new FetchResult(index, name, null, error);
    }

    public boolean isSuccess() {
        return thumbnail != null;
    }
}
