package com.starscape.gallery.features.repositories.app;

import com.starscape.gallery.common.cache.TtlCache;
import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.gallerylayout.app.JustifiedRowLayout;
import com.starscape.gallery.features.ratelimit.app.RateLimitTracker;
import com.starscape.gallery.features.repositories.api.dto.GalleryResponse;
import com.starscape.gallery.features.repositories.domain.ContentEntry;
import com.starscape.gallery.features.repositories.domain.ContentHostingClient;
import com.starscape.gallery.features.repositories.domain.RepositorySummary;
import com.starscape.gallery.features.thumbnails.app.ThumbnailCropper;
import com.starscape.gallery.features.thumbnails.app.ThumbnailLoader;
import com.starscape.gallery.features.thumbnails.domain.AssetFetcher;
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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GalleryServiceTest {

    private final CountDownLatch entered = new CountDownLatch(2);
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicBoolean blockDownloads = new AtomicBoolean(true);
    private final ExecutorService background = Executors.newSingleThreadExecutor();

    private ThumbnailLoader loader;
    private GalleryService service;

    @BeforeEach
    void setUp() throws IOException {
        byte[] image = TestImages.bands(60, 30);
        GalleryProperties properties = new GalleryProperties();
        properties.getFetch().setMaxWorkers(2);
        properties.getFetch().setJoinTimeout(Duration.ofSeconds(5));
        properties.getFetch().setBatchTimeout(Duration.ofSeconds(10));
        GalleryCache cache = new GalleryCache(
            new TtlCache<>(Clock.systemUTC(), Duration.ofMinutes(5), 100, true), properties);

        AssetFetcher fetcher = url -> {
            if (blockDownloads.get()) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return image;
        };
        loader = new ThumbnailLoader(
            fetcher, new ThumbnailCropper(16), cache, new RateLimitTracker(Clock.systemUTC(), properties), properties);

        ContentHostingClient client = mock(ContentHostingClient.class);
        when(client.listRepositories()).thenReturn(List.of(
            new RepositorySummary("family", null, "https://github.com/lifetime-memories/family", true)));
        when(client.listContents(eq("family"), anyString())).thenReturn(List.of(
            new ContentEntry("a.png", "thumbnails/a.png", 512, "file", "https://raw.example/family/a.png"),
            new ContentEntry("b.png", "thumbnails/b.png", 512, "file", "https://raw.example/family/b.png")));

        service = new GalleryService(client, loader, new JustifiedRowLayout(properties), cache, properties);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        loader.shutdown();
        background.shutdownNow();
    }

    @Test
    void loadsEveryThumbnail() throws Exception {
        blockDownloads.set(false);

        GalleryResponse response = service.loadGallery("family", 600);

        assertEquals(2, response.loadedCount());
        assertEquals(0, response.failedCount());
        assertEquals(2, response.tiles().size());
    }

    @Test
    @DisplayName("A gallery load replaced by a newer one for the same repository fails instead of reporting empty tiles")
    void supersededLoadIsRejected() throws Exception {
        Future<GalleryResponse> first = background.submit(() -> service.loadGallery("family", 600));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        blockDownloads.set(false);
        releaseLater();
        GalleryResponse second = service.loadGallery("family", 600);

        assertEquals(2, second.loadedCount());
        assertEquals(0, second.failedCount());

        ExecutionException failure = assertThrows(ExecutionException.class, () -> first.get(10, TimeUnit.SECONDS));
        IllegalStateException cause = assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertTrue(cause.getMessage().contains("superseded"), cause.getMessage());
    }

    @Test
    void rejectsNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> service.loadGallery("family", 0));
    }

    /**
     * Unblocks the first batch only after the second load has had time to cancel it.
     */
    private void releaseLater() {
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.setDaemon(true);
        releaser.start();
    }
}
