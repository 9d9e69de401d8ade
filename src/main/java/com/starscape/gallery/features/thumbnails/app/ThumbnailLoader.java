package com.starscape.gallery.features.thumbnails.app;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.ratelimit.app.RateLimitTracker;
import com.starscape.gallery.features.ratelimit.domain.RateLimitLevel;
import com.starscape.gallery.features.repositories.app.GalleryCache;
import com.starscape.gallery.features.thumbnails.domain.AssetFetcher;
import com.starscape.gallery.features.thumbnails.domain.FetchListener;
import com.starscape.gallery.features.thumbnails.domain.FetchResult;
import com.starscape.gallery.features.thumbnails.domain.FetchSummary;
import com.starscape.gallery.features.thumbnails.domain.GalleryItem;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts thumbnail pipelines on behalf of gallery views.
 *
 * A view owns at most one active pipeline. Loading a new batch for a view first cancels
 * the previous pipeline and waits for it to finish, so results of a superseded repository
 * selection can never land on the new selection.
 */
@Service
public class ThumbnailLoader {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailLoader.class);

    private final Map<String, ThumbnailFetchPipeline> activePipelines = new ConcurrentHashMap<>();
    private final AssetFetcher fetcher;
    private final ThumbnailCropper cropper;
    private final GalleryCache cache;
    private final RateLimitTracker rateLimitTracker;
    private final int maxWorkers;
    private final Duration joinTimeout;

    public ThumbnailLoader(
            AssetFetcher fetcher,
            ThumbnailCropper cropper,
            GalleryCache cache,
            RateLimitTracker rateLimitTracker,
            GalleryProperties properties) {
        this.fetcher = fetcher;
        this.cropper = cropper;
        this.cache = cache;
        this.rateLimitTracker = rateLimitTracker;
        this.maxWorkers = properties.getFetch().getMaxWorkers();
        this.joinTimeout = properties.getFetch().getJoinTimeout();
    }

    /**
     * Replace the view's current batch with a new one and start loading it.
     */
    public synchronized ThumbnailFetchPipeline load(String viewId, List<GalleryItem> items, FetchListener listener)
            throws InterruptedException {
        cancelActive(viewId);

        RateLimitLevel level = rateLimitTracker.level();
        if (level == RateLimitLevel.WARNING || level == RateLimitLevel.CRITICAL) {
            log.warn("Loading {} thumbnails for view {} with rate limit level {}", items.size(), viewId, level);
        }

        ThumbnailFetchPipeline[] self = new ThumbnailFetchPipeline[1];
        FetchListener tracking = new FetchListener() {
            @Override
            public void onItemLoaded(FetchResult result) {
                listener.onItemLoaded(result);
            }

            @Override
            public void onFinished(FetchSummary summary) {
                try {
                    listener.onFinished(summary);
                } finally {
                    if (self[0] != null) {
                        activePipelines.remove(viewId, self[0]);
                    }
                }
            }
        };

        ThumbnailFetchPipeline pipeline = new ThumbnailFetchPipeline(
            viewId, items, fetcher, cropper, cache, tracking, maxWorkers);
        self[0] = pipeline;
        activePipelines.put(viewId, pipeline);
        return pipeline.start();
    }

    /**
     * Cancel the view's active pipeline, if any, and wait for it to finish.
     * @return true if a pipeline was cancelled
     */
    public synchronized boolean cancel(String viewId) throws InterruptedException {
        return cancelActive(viewId);
    }

    public Optional<ThumbnailFetchPipeline> activePipeline(String viewId) {
        return Optional.ofNullable(activePipelines.get(viewId));
    }

    @PreDestroy
    public synchronized void shutdown() {
        for (String viewId : List.copyOf(activePipelines.keySet())) {
            try {
                cancelActive(viewId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while cancelling thumbnail pipelines");
                return;
            }
        }
    }

    private boolean cancelActive(String viewId) throws InterruptedException {
        ThumbnailFetchPipeline previous = activePipelines.remove(viewId);
        if (previous == null) {
            return false;
        }
        log.debug("Cancelling previous thumbnail pipeline for view {}", viewId);
        previous.cancelAndJoin(joinTimeout);
        return true;
    }
}
