package com.starscape.gallery.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the gallery engine.
 * Binds to app.gallery.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.gallery")
public class GalleryProperties {

    private final Layout layout = new Layout();
    private final Fetch fetch = new Fetch();
    private final Cache cache = new Cache();
    private final RateLimit rateLimit = new RateLimit();
    private final Build build = new Build();

    public Layout getLayout() {
        return layout;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Cache getCache() {
        return cache;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Build getBuild() {
        return build;
    }

    public static class Layout {

        private int rowHeight = 120;
        private int spacing = 6;
        private int masonryColumns = 6;

        public int getRowHeight() {
            return rowHeight;
        }

        public void setRowHeight(int rowHeight) {
            this.rowHeight = rowHeight;
        }

        public int getSpacing() {
            return spacing;
        }

        public void setSpacing(int spacing) {
            this.spacing = spacing;
        }

        public int getMasonryColumns() {
            return masonryColumns;
        }

        public void setMasonryColumns(int masonryColumns) {
            this.masonryColumns = masonryColumns;
        }
    }

    public static class Fetch {

        private int maxWorkers = 8;
        private Duration timeout = Duration.ofSeconds(10);
        private int thumbnailSize = 220;
        private String thumbnailsPath = "thumbnails";
        private Duration batchTimeout = Duration.ofMinutes(2);
        private Duration joinTimeout = Duration.ofSeconds(15);

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getThumbnailSize() {
            return thumbnailSize;
        }

        public void setThumbnailSize(int thumbnailSize) {
            this.thumbnailSize = thumbnailSize;
        }

        public String getThumbnailsPath() {
            return thumbnailsPath;
        }

        public void setThumbnailsPath(String thumbnailsPath) {
            this.thumbnailsPath = thumbnailsPath;
        }

        public Duration getBatchTimeout() {
            return batchTimeout;
        }

        public void setBatchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
        }

        public Duration getJoinTimeout() {
            return joinTimeout;
        }

        public void setJoinTimeout(Duration joinTimeout) {
            this.joinTimeout = joinTimeout;
        }
    }

    public static class Cache {

        private boolean enabled = true;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private int maxSize = 1000;
        private Duration repositoryListTtl = Duration.ofMinutes(5);
        private Duration contentsTtl = Duration.ofMinutes(3);
        private Duration thumbnailTtl = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getRepositoryListTtl() {
            return repositoryListTtl;
        }

        public void setRepositoryListTtl(Duration repositoryListTtl) {
            this.repositoryListTtl = repositoryListTtl;
        }

        public Duration getContentsTtl() {
            return contentsTtl;
        }

        public void setContentsTtl(Duration contentsTtl) {
            this.contentsTtl = contentsTtl;
        }

        public Duration getThumbnailTtl() {
            return thumbnailTtl;
        }

        public void setThumbnailTtl(Duration thumbnailTtl) {
            this.thumbnailTtl = thumbnailTtl;
        }
    }

    public static class RateLimit {

        private int warningThreshold = 100;
        private int criticalThreshold = 10;

        public int getWarningThreshold() {
            return warningThreshold;
        }

        public void setWarningThreshold(int warningThreshold) {
            this.warningThreshold = warningThreshold;
        }

        public int getCriticalThreshold() {
            return criticalThreshold;
        }

        public void setCriticalThreshold(int criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
        }
    }

    public static class Build {

        private int maxAttempts = 60;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration joinTimeout = Duration.ofSeconds(15);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getJoinTimeout() {
            return joinTimeout;
        }

        public void setJoinTimeout(Duration joinTimeout) {
            this.joinTimeout = joinTimeout;
        }
    }
}
