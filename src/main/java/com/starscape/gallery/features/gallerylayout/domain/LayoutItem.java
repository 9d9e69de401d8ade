package com.starscape.gallery.features.gallerylayout.domain;

/**
 * Anything that can be placed in a gallery layout.
 */
public interface LayoutItem {

    /**
     * Width divided by height. Values that are not finite or not positive are laid out as squares.
     */
    double aspectRatio();

    static double effectiveAspectRatio(LayoutItem item) {
        double aspect = item.aspectRatio();
        return Double.isFinite(aspect) && aspect > 0 ? aspect : 1.0;
    }

    /**
     * Round a computed length to whole pixels, clamped to {@code [1, Integer.MAX_VALUE]}.
     */
    static int toPixels(double length) {
        long rounded = Math.round(length);
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, rounded));
    }
}
