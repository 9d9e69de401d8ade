package com.starscape.gallery.features.thumbnails.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ticket for one queued or in-flight thumbnail download.
 * Cancellation is one-way: once set the flag is never cleared.
 */
public class FetchTask {

    private final int index;
    private final GalleryItem item;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile String worker;

    public FetchTask(int index, GalleryItem item) {
        this.index = index;
        this.item = item;
    }

    public int getIndex() {
        return index;
    }

    public GalleryItem getItem() {
        return item;
    }

    public String getWorker() {
        return worker;
    }

    public void assignTo(String worker) {
        this.worker = worker;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
