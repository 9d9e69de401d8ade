package com.starscape.gallery.features.thumbnails.domain;

import com.starscape.gallery.features.gallerylayout.domain.LayoutItem;
import com.starscape.gallery.features.repositories.domain.ContentEntry;

/**
 * One image of a repository gallery.
 *
 * Created from a directory listing. The intrinsic dimensions stay unknown (square aspect)
 * until the image has been decoded.
 */
public class GalleryItem implements LayoutItem {

    private final String repository;
    private final String path;
    private final String name;
    private final long size;
    private final String downloadUrl;

    private volatile int width;
    private volatile int height;

    public GalleryItem(String repository, String path, String name, long size, String downloadUrl) {
        this.repository = repository;
        this.path = path;
        this.name = name;
        this.size = size;
        this.downloadUrl = downloadUrl;
    }

    public static GalleryItem fromListing(String repository, ContentEntry entry) {
        String path = entry.path() != null ? entry.path() : entry.name();
        return new GalleryItem(repository, path, entry.name(), entry.size(), entry.downloadUrl());
    }

    public String getRepository() {
        return repository;
    }

    public String getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    public long getSize() {
        return size;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public synchronized void recordDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive");
        }
        this.width = width;
        this.height = height;
    }

    public synchronized boolean hasDimensions() {
        return width > 0 && height > 0;
    }

    @Override
    public synchronized double aspectRatio() {
        return hasDimensions() ? (double) width / height : 1.0;
    }

    @Override
    public String toString() {
        return repository + "/" + path;
    }
}
