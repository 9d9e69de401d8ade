package com.starscape.gallery.features.repositories.app;

import com.starscape.gallery.common.cache.CacheStats;
import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.common.exception.NotFoundException;
import com.starscape.gallery.features.gallerylayout.app.JustifiedRowLayout;
import com.starscape.gallery.features.gallerylayout.domain.LayoutResult;
import com.starscape.gallery.features.gallerylayout.domain.Placement;
import com.starscape.gallery.features.repositories.api.dto.GalleryResponse;
import com.starscape.gallery.features.repositories.api.dto.GalleryTile;
import com.starscape.gallery.features.repositories.domain.ContentEntry;
import com.starscape.gallery.features.repositories.domain.ContentHostingClient;
import com.starscape.gallery.features.repositories.domain.RepositorySummary;
import com.starscape.gallery.features.thumbnails.app.ThumbnailFetchPipeline;
import com.starscape.gallery.features.thumbnails.app.ThumbnailLoader;
import com.starscape.gallery.features.thumbnails.domain.FetchListener;
import com.starscape.gallery.features.thumbnails.domain.FetchResult;
import com.starscape.gallery.features.thumbnails.domain.FetchSummary;
import com.starscape.gallery.features.thumbnails.domain.GalleryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Builds repository galleries: lists the thumbnails directory, loads every thumbnail
 * through the {@link ThumbnailLoader} and lays the results out in justified rows.
 */
@Service
public class GalleryService {

    private static final Logger log = LoggerFactory.getLogger(GalleryService.class);

    private final ContentHostingClient contentHostingClient;
    private final ThumbnailLoader thumbnailLoader;
    private final JustifiedRowLayout layout;
    private final GalleryCache cache;
    private final String thumbnailsPath;
    private final Duration batchTimeout;

    public GalleryService(
            ContentHostingClient contentHostingClient,
            ThumbnailLoader thumbnailLoader,
            JustifiedRowLayout layout,
            GalleryCache cache,
            GalleryProperties properties) {
        this.contentHostingClient = contentHostingClient;
        this.thumbnailLoader = thumbnailLoader;
        this.layout = layout;
        this.cache = cache;
        this.thumbnailsPath = properties.getFetch().getThumbnailsPath();
        this.batchTimeout = properties.getFetch().getBatchTimeout();
    }

    public List<RepositorySummary> listRepositories() {
        return contentHostingClient.listRepositories();
    }

    public GalleryResponse loadGallery(String repository, int width) throws InterruptedException {
        String name = RepositoryNames.validate(repository);
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive");
        }
        requireKnown(name);

        List<GalleryItem> items = contentHostingClient.listContents(name, thumbnailsPath).stream()
                .filter(ContentEntry::isFile)
                .map(entry -> GalleryItem.fromListing(name, entry))
                .toList();
        if (items.isEmpty()) {
            log.info("No thumbnails found for {}", name);
            return GalleryResponse.empty(name, width);
        }

        Map<Integer, FetchResult> results = new ConcurrentHashMap<>();
        AtomicReference<FetchSummary> finished = new AtomicReference<>();
        ThumbnailFetchPipeline pipeline = thumbnailLoader.load(viewId(name), items, new FetchListener() {
            @Override
            public void onItemLoaded(FetchResult result) {
                results.put(result.index(), result);
            }

            @Override
            public void onFinished(FetchSummary summary) {
                finished.set(summary);
                log.debug("Gallery batch for {} finished: {}", name, summary);
            }
        });

        if (!pipeline.awaitCompletion(batchTimeout)) {
            thumbnailLoader.cancel(viewId(name));
            throw new IllegalStateException(
                "Timed out after " + batchTimeout.toSeconds() + "s loading thumbnails for " + name);
        }
        FetchSummary summary = finished.get();
        if (summary == null || summary.cancelled()) {
            // a newer load of the same gallery cancelled this batch
            throw new IllegalStateException("Gallery load for " + name + " was superseded by a newer request");
        }

        LayoutResult<GalleryItem> result = layout.layout(items, width);
        List<GalleryTile> tiles = new ArrayList<>(items.size());
        int loaded = 0;
        int failed = 0;
        for (Placement<GalleryItem> placement : result.placements()) {
            FetchResult fetched = results.get(placement.index());
            boolean success = fetched != null && fetched.isSuccess();
            if (success) {
                loaded++;
            } else {
                failed++;
            }
            GalleryItem item = placement.item();
            tiles.add(new GalleryTile(
                placement.index(),
                item.getName(),
                item.getPath(),
                placement.x(),
                placement.y(),
                placement.width(),
                placement.height(),
                success,
                fetched == null ? "Not loaded" : fetched.error()
            ));
        }

        log.info("Built gallery for {}: tiles={}, loaded={}, failed={}, height={}",
            name, tiles.size(), loaded, failed, result.totalHeight());
        return new GalleryResponse(name, width, result.totalHeight(), loaded, failed, tiles);
    }

    /**
     * Drop every cached listing and thumbnail of the repository.
     * @return the number of entries removed
     */
    public int invalidate(String repository) {
        String name = RepositoryNames.validate(repository);
        int removed = cache.invalidateRepository(name);
        log.info("Invalidated {} cached entries for {}", removed, name);
        return removed;
    }

    public int invalidateAll() {
        int removed = cache.invalidateAll();
        log.info("Invalidated {} cached entries", removed);
        return removed;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    static String viewId(String repository) {
        return "gallery:" + repository;
    }

    private void requireKnown(String repository) {
        boolean known = contentHostingClient.listRepositories().stream()
                .anyMatch(summary -> summary.name().equals(repository));
        if (!known) {
            throw new NotFoundException("Repository not found: " + repository);
        }
    }
}
