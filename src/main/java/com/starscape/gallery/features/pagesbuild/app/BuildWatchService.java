package com.starscape.gallery.features.pagesbuild.app;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.pagesbuild.domain.BuildAttempt;
import com.starscape.gallery.features.pagesbuild.domain.BuildOutcome;
import com.starscape.gallery.features.pagesbuild.domain.BuildStatusListener;
import com.starscape.gallery.features.pagesbuild.domain.PagesStatusSource;
import com.starscape.gallery.features.repositories.app.GalleryCache;
import com.starscape.gallery.features.repositories.domain.ContentHostingClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs at most one {@link BuildStatusPoller} per repository, each on its own daemon thread.
 *
 * Starting a watch for a repository that is already watched cancels and joins the previous
 * poller first. A finished watch forgets itself; a successful build also drops the
 * repository's cached listings since the published content has changed.
 */
@Service
public class BuildWatchService {

    private static final Logger log = LoggerFactory.getLogger(BuildWatchService.class);

    private final Map<String, Watch> watches = new ConcurrentHashMap<>();
    private final PagesStatusSource statusSource;
    private final BuildStatusListener listener;
    private final GalleryCache cache;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration pollInterval;
    private final Duration initialDelay;
    private final Duration joinTimeout;

    @Autowired
    public BuildWatchService(
            ContentHostingClient contentHostingClient,
            BuildStatusBroadcaster broadcaster,
            GalleryCache cache,
            Clock clock,
            GalleryProperties properties) {
        this(contentHostingClient::getPagesStatus, broadcaster, cache, clock, properties.getBuild());
    }

    BuildWatchService(
            PagesStatusSource statusSource,
            BuildStatusListener listener,
            GalleryCache cache,
            Clock clock,
            GalleryProperties.Build build) {
        this.statusSource = statusSource;
        this.listener = listener;
        this.cache = cache;
        this.clock = clock;
        this.maxAttempts = build.getMaxAttempts();
        this.pollInterval = build.getPollInterval();
        this.initialDelay = build.getInitialDelay();
        this.joinTimeout = build.getJoinTimeout();
    }

    /**
     * Start watching the repository's Pages build, replacing any running watch.
     */
    public synchronized BuildStatusPoller startWatching(String repository) throws InterruptedException {
        stopActive(repository);

        Watch[] self = new Watch[1];
        BuildStatusListener tracking = new BuildStatusListener() {
            @Override
            public void onStatusChanged(String repo, BuildAttempt attempt) {
                listener.onStatusChanged(repo, attempt);
            }

            @Override
            public void onCompleted(String repo, BuildOutcome outcome) {
                try {
                    if (outcome.isSuccess()) {
                        int removed = cache.invalidateRepository(repo);
                        log.debug("Invalidated {} cached entries after build of {}", removed, repo);
                    }
                    listener.onCompleted(repo, outcome);
                } finally {
                    if (self[0] != null) {
                        watches.remove(repo, self[0]);
                    }
                }
            }
        };

        BuildStatusPoller poller = new BuildStatusPoller(
            repository, statusSource, tracking, maxAttempts, pollInterval, initialDelay, clock);
        Thread thread = new Thread(poller, "pages-poller-" + repository);
        thread.setDaemon(true);

        Watch watch = new Watch(poller, thread);
        self[0] = watch;
        watches.put(repository, watch);
        thread.start();
        log.info("Started Pages build watch for {}", repository);
        return poller;
    }

    /**
     * Cancel the repository's watch, if any, and wait for its thread to exit.
     * @return true if a watch was running
     */
    public synchronized boolean stopWatching(String repository) throws InterruptedException {
        return stopActive(repository);
    }

    public boolean isWatching(String repository) {
        Watch watch = watches.get(repository);
        return watch != null && !watch.poller().isFinished();
    }

    @PreDestroy
    public synchronized void shutdown() {
        for (String repository : List.copyOf(watches.keySet())) {
            try {
                stopActive(repository);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping build watches");
                return;
            }
        }
    }

    private boolean stopActive(String repository) throws InterruptedException {
        Watch previous = watches.remove(repository);
        if (previous == null) {
            return false;
        }
        previous.poller().cancel();
        previous.thread().join(joinTimeout.toMillis());
        if (previous.thread().isAlive()) {
            log.warn("Build poller for {} did not stop within {}ms", repository, joinTimeout.toMillis());
        }
        log.info("Stopped Pages build watch for {}", repository);
        return true;
    }

    private record Watch(BuildStatusPoller poller, Thread thread) {
    }
}
