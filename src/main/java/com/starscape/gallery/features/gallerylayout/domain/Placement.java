package com.starscape.gallery.features.gallerylayout.domain;

/**
 * Position of one item in the laid-out gallery.
 *
 * @param index position of the item in the input list
 */
public record Placement<T extends LayoutItem>(
    T item,
    int index,
    int x,
    int y,
    int width,
    int height
) {}
