package com.starscape.gallery.features.repositories.api.dto;

/**
 * One positioned thumbnail of a gallery.
 */
public record GalleryTile(
    int index,
    String name,
    String path,
    int x,
    int y,
    int width,
    int height,
    boolean loaded,
    String error
) {}
