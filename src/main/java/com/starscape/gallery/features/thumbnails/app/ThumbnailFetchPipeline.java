package com.starscape.gallery.features.thumbnails.app;

import com.starscape.gallery.features.repositories.app.GalleryCache;
import com.starscape.gallery.features.thumbnails.domain.AssetFetcher;
import com.starscape.gallery.features.thumbnails.domain.FetchListener;
import com.starscape.gallery.features.thumbnails.domain.FetchResult;
import com.starscape.gallery.features.thumbnails.domain.FetchSummary;
import com.starscape.gallery.features.thumbnails.domain.FetchTask;
import com.starscape.gallery.features.thumbnails.domain.GalleryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads, decodes and crops one batch of gallery thumbnails on a bounded worker pool.
 *
 * Each item produces exactly one completion (loaded or failed) delivered as soon as it is
 * ready, in no particular order, followed by a single {@link FetchListener#onFinished}.
 * One item's failure never affects the others and nothing is retried.
 *
 * Cancellation is cooperative. Queued tasks skip the download, in-flight tasks skip the
 * decode, and whatever still finishes is discarded. Once {@link #cancel()} has returned no
 * further item completions reach the listener, but the finished event is still delivered
 * after every task has been accounted for.
 *
 * A pipeline runs once; start a new one for a new batch.
 */
public class ThumbnailFetchPipeline {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailFetchPipeline.class);

    private final String viewId;
    private final List<FetchTask> tasks;
    private final AssetFetcher fetcher;
    private final ThumbnailCropper cropper;
    private final GalleryCache cache;
    private final FetchListener listener;
    private final int workerCount;

    // guards listener delivery against a concurrent cancel
    private final Object emitLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger remaining;
    private final AtomicInteger loaded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final CountDownLatch done = new CountDownLatch(1);

    private ExecutorService executor;

    public ThumbnailFetchPipeline(
            String viewId,
            List<GalleryItem> items,
            AssetFetcher fetcher,
            ThumbnailCropper cropper,
            GalleryCache cache,
            FetchListener listener,
            int maxWorkers) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("Max workers must be positive");
        }
        this.viewId = viewId;
        this.fetcher = fetcher;
        this.cropper = cropper;
        this.cache = cache;
        this.listener = listener;
        this.workerCount = Math.min(maxWorkers, Math.max(1, items.size()));

        List<FetchTask> queued = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            queued.add(new FetchTask(i, items.get(i)));
        }
        this.tasks = List.copyOf(queued);
        this.remaining = new AtomicInteger(tasks.size());
    }

    public ThumbnailFetchPipeline start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already started: " + viewId);
        }

        log.info("Starting thumbnail pipeline: view={}, items={}, workers={}", viewId, tasks.size(), workerCount);

        if (tasks.isEmpty()) {
            finish();
            return this;
        }

        AtomicInteger threadCounter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "thumbnail-" + viewId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (FetchTask task : tasks) {
            executor.execute(() -> process(task));
        }
        // lets the pool threads exit once the queue drains
        executor.shutdown();
        return this;
    }

    /**
     * Idempotent. Marks the pipeline and every task as cancelled.
     */
    public void cancel() {
        synchronized (emitLock) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            tasks.forEach(FetchTask::cancel);
        }
        log.info("Cancelled thumbnail pipeline: view={}, outstanding={}", viewId, remaining.get());
    }

    /**
     * Wait until every task has been accounted for and the finished event was delivered.
     * @return false if the timeout elapsed first
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void cancelAndJoin(Duration timeout) throws InterruptedException {
        cancel();
        if (!awaitCompletion(timeout)) {
            log.warn("Thumbnail pipeline did not finish within {}ms after cancel: view={}", timeout.toMillis(), viewId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public String getViewId() {
        return viewId;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public List<FetchTask> getTasks() {
        return tasks;
    }

    private void process(FetchTask task) {
        task.assignTo(Thread.currentThread().getName());
        try {
            Optional<FetchResult> result = task.isCancelled() ? Optional.empty() : fetchAndDecode(task);
            if (result.isEmpty()) {
                skipped.incrementAndGet();
                return;
            }
            deliver(result.get());
        } finally {
            if (remaining.decrementAndGet() == 0) {
                finish();
            }
        }
    }

    /**
     * @return empty when the task was cancelled before producing a result
     */
    private Optional<FetchResult> fetchAndDecode(FetchTask task) {
        GalleryItem item = task.getItem();
        try {
            byte[] bytes = cache.getThumbnail(item.getRepository(), item.getPath()).orElse(null);
            boolean downloaded = false;
            if (bytes == null) {
                if (task.isCancelled()) {
                    return Optional.empty();
                }
                bytes = fetcher.fetch(item.getDownloadUrl());
                if (bytes == null || bytes.length == 0) {
                    return Optional.of(FetchResult.failed(task.getIndex(), item.getName(), "Empty response"));
                }
                downloaded = true;
            }

            if (task.isCancelled()) {
                return Optional.empty();
            }

            BufferedImage image = cropper.decode(bytes);
            // only bytes that decode are worth keeping
            if (downloaded) {
                cache.putThumbnail(item.getRepository(), item.getPath(), bytes);
            }
            item.recordDimensions(image.getWidth(), image.getHeight());
            BufferedImage thumbnail = cropper.cropToSquare(image);
            return Optional.of(FetchResult.loaded(task.getIndex(), item.getName(), thumbnail));

        } catch (Exception e) {
            log.warn("Failed to load thumbnail {}: {}", item, e.getMessage());
            return Optional.of(FetchResult.failed(task.getIndex(), item.getName(), e.getMessage()));
        }
    }

    private void deliver(FetchResult result) {
        synchronized (emitLock) {
            if (cancelled.get()) {
                skipped.incrementAndGet();
                log.debug("Discarded thumbnail after cancel: view={}, index={}", viewId, result.index());
                return;
            }
            if (result.isSuccess()) {
                loaded.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
            try {
                listener.onItemLoaded(result);
            } catch (RuntimeException e) {
                log.error("Thumbnail listener failed: view={}, index={}", viewId, result.index(), e);
            }
        }
    }

    private void finish() {
        FetchSummary summary = new FetchSummary(
            tasks.size(),
            loaded.get(),
            failed.get(),
            skipped.get(),
            cancelled.get()
        );
        try {
            listener.onFinished(summary);
        } catch (RuntimeException e) {
            log.error("Thumbnail listener failed on finish: view={}", viewId, e);
        } finally {
            done.countDown();
        }
        log.info("Thumbnail pipeline finished: view={}, loaded={}, failed={}, skipped={}",
            viewId, summary.loaded(), summary.failed(), summary.skipped());
    }
}
