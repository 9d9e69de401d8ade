package com.starscape.gallery.features.thumbnails.app;

import com.starscape.gallery.common.cache.TtlCache;
import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.ratelimit.app.RateLimitTracker;
import com.starscape.gallery.features.repositories.app.GalleryCache;
import com.starscape.gallery.features.thumbnails.domain.AssetFetcher;
import com.starscape.gallery.features.thumbnails.domain.GalleryItem;
import com.starscape.gallery.support.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ThumbnailLoaderTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private RateLimitTracker rateLimitTracker;
    private ThumbnailLoader loader;
    private byte[] image;

    @BeforeEach
    void setUp() throws IOException {
        image = TestImages.bands(30, 30);
        GalleryProperties properties = new GalleryProperties();
        properties.getFetch().setMaxWorkers(2);
        properties.getFetch().setJoinTimeout(Duration.ofSeconds(5));
        TtlCache<Object> store = new TtlCache<>(Clock.systemUTC(), Duration.ofMinutes(5), 100, true);
        GalleryCache cache = new GalleryCache(store, properties);
        rateLimitTracker = new RateLimitTracker(Clock.systemUTC(), properties);

        AssetFetcher fetcher = url -> {
            if (url.contains("slow")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return image;
        };
        loader = new ThumbnailLoader(fetcher, new ThumbnailCropper(16), cache, rateLimitTracker, properties);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        loader.shutdown();
    }

    @Test
    @DisplayName("Loading a new batch for a view cancels the previous batch first")
    void newBatchSupersedesPrevious() throws Exception {
        RecordingFetchListener first = new RecordingFetchListener();
        RecordingFetchListener second = new RecordingFetchListener();

        ThumbnailFetchPipeline stale = loader.load("gallery:family", List.of(item("slow", "a.png")), first);
        Thread releaser = releaseLater();
        ThumbnailFetchPipeline current = loader.load("gallery:family", List.of(item("fast", "b.png")), second);

        assertTrue(stale.isCancelled());
        assertTrue(stale.isDone(), "Previous pipeline must be joined before the new one starts");
        assertTrue(first.results().isEmpty());
        assertTrue(first.onlySummary().cancelled());

        assertTrue(current.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(1, second.onlySummary().loaded());
        releaser.join();
    }

    @Test
    void viewsAreIndependent() throws Exception {
        RecordingFetchListener one = new RecordingFetchListener();
        RecordingFetchListener two = new RecordingFetchListener();

        ThumbnailFetchPipeline a = loader.load("gallery:one", List.of(item("fast", "a.png")), one);
        ThumbnailFetchPipeline b = loader.load("gallery:two", List.of(item("fast", "b.png")), two);

        assertTrue(a.awaitCompletion(Duration.ofSeconds(10)));
        assertTrue(b.awaitCompletion(Duration.ofSeconds(10)));
        assertFalse(a.isCancelled());
        assertEquals(1, one.onlySummary().loaded());
        assertEquals(1, two.onlySummary().loaded());
    }

    @Test
    @DisplayName("A finished pipeline is no longer tracked as active")
    void finishedPipelineIsForgotten() throws Exception {
        ThumbnailFetchPipeline pipeline = loader.load("gallery:family", List.of(item("fast", "a.png")), new RecordingFetchListener());

        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(10)));
        assertTrue(loader.activePipeline("gallery:family").isEmpty());
        assertFalse(loader.cancel("gallery:family"));
    }

    @Test
    void cancelStopsActivePipeline() throws Exception {
        RecordingFetchListener listener = new RecordingFetchListener();
        ThumbnailFetchPipeline pipeline = loader.load("gallery:family", List.of(item("slow", "a.png")), listener);
        assertTrue(loader.activePipeline("gallery:family").isPresent());

        Thread releaser = releaseLater();
        assertTrue(loader.cancel("gallery:family"));

        assertTrue(pipeline.isDone());
        assertTrue(listener.onlySummary().cancelled());
        releaser.join();
    }

    @Test
    @DisplayName("Low quota is reported but does not block loading")
    void lowQuotaDoesNotBlock() throws Exception {
        rateLimitTracker.record(3, 0L);
        RecordingFetchListener listener = new RecordingFetchListener();

        ThumbnailFetchPipeline pipeline = loader.load("gallery:family", List.of(item("fast", "a.png")), listener);

        assertTrue(pipeline.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(1, listener.onlySummary().loaded());
    }

    /**
     * Unblocks slow downloads shortly after the caller has started cancelling.
     */
    private Thread releaseLater() {
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.start();
        return releaser;
    }

    private static GalleryItem item(String speed, String name) {
        return new GalleryItem("family", "thumbnails/" + name, name, 100, "https://raw.example/" + speed + "/" + name);
    }
}
