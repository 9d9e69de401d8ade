package com.starscape.gallery.common.config;

import com.starscape.gallery.common.cache.TtlCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-wide engine beans. The cache is created once at startup and shared by every
 * request and fetch worker.
 */
@Configuration
public class GalleryEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TtlCache<Object> galleryTtlCache(Clock clock, GalleryProperties properties) {
        GalleryProperties.Cache cache = properties.getCache();
        return new TtlCache<>(clock, cache.getDefaultTtl(), cache.getMaxSize(), cache.isEnabled());
    }
}
