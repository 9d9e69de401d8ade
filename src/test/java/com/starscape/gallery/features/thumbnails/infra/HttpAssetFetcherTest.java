package com.starscape.gallery.features.thumbnails.infra;

import com.starscape.gallery.common.config.GalleryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpAssetFetcherTest {

    private HttpAssetFetcher fetcher;

    @BeforeEach
    void setUp() {
        GalleryProperties properties = new GalleryProperties();
        properties.getFetch().setTimeout(Duration.ofMillis(500));
        fetcher = new HttpAssetFetcher(RestClient.builder(), properties);
    }

    @Test
    void missingUrlIsAnIoFailure() {
        assertThrows(IOException.class, () -> fetcher.fetch(null));
        assertThrows(IOException.class, () -> fetcher.fetch("  "));
    }

    @Test
    void unreachableHostIsAnIoFailure() {
        IOException ex = assertThrows(IOException.class, () -> fetcher.fetch("http://127.0.0.1:1/thumbnails/a.jpg"));
        assertTrue(ex.getMessage().contains("127.0.0.1:1"));
    }
}
