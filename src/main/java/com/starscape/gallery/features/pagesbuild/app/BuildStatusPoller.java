package com.starscape.gallery.features.pagesbuild.app;

import com.starscape.gallery.features.pagesbuild.domain.BuildAttempt;
import com.starscape.gallery.features.pagesbuild.domain.BuildOutcome;
import com.starscape.gallery.features.pagesbuild.domain.BuildStatus;
import com.starscape.gallery.features.pagesbuild.domain.BuildStatusListener;
import com.starscape.gallery.features.pagesbuild.domain.PagesStatusSource;
import com.starscape.gallery.features.repositories.domain.PagesStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the Pages status of one repository until the build reaches a terminal state or the
 * attempt budget runs out.
 *
 * After an initial grace delay the poller performs at most {@code maxAttempts} polls
 * separated by {@code pollInterval}. A built site completes with SUCCEEDED, an errored
 * build, a missing Pages site or any exception while polling completes with FAILED, and an
 * exhausted budget completes with TIMED_OUT. Non-terminal statuses are reported only when
 * they differ from the previous poll.
 *
 * {@link #cancel()} wakes a waiting poller immediately. A cancelled poller stops without
 * reporting a completion.
 */
public class BuildStatusPoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BuildStatusPoller.class);

    private final String repository;
    private final PagesStatusSource source;
    private final BuildStatusListener listener;
    private final int maxAttempts;
    private final Duration pollInterval;
    private final Duration initialDelay;
    private final Clock clock;

    // guards listener delivery against a concurrent cancel
    private final Object emitLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger attempts = new AtomicInteger();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile BuildOutcome outcome;

    public BuildStatusPoller(
            String repository,
            PagesStatusSource source,
            BuildStatusListener listener,
            int maxAttempts,
            Duration pollInterval,
            Duration initialDelay,
            Clock clock) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        if (pollInterval.isNegative() || initialDelay.isNegative()) {
            throw new IllegalArgumentException("Poll delays must not be negative");
        }
        this.repository = repository;
        this.source = source;
        this.listener = listener;
        this.maxAttempts = maxAttempts;
        this.pollInterval = pollInterval;
        this.initialDelay = initialDelay;
        this.clock = clock;
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Poller already started: " + repository);
        }
        log.info("Watching Pages build: repo={}, maxAttempts={}, interval={}ms",
            repository, maxAttempts, pollInterval.toMillis());
        try {
            poll();
        } finally {
            finished.countDown();
        }
    }

    private void poll() {
        if (!pause(initialDelay)) {
            return;
        }

        BuildStatus previous = null;
        while (attempts.get() < maxAttempts) {
            if (cancelled.get()) {
                return;
            }
            int attempt = attempts.incrementAndGet();

            PagesStatus status;
            try {
                status = source.fetch(repository);
            } catch (RuntimeException e) {
                log.warn("Error checking build status: repo={}, attempt={}", repository, attempt, e);
                complete(BuildOutcome.failed("Error checking build status: " + e.getMessage(), attempt));
                return;
            }

            if (status == null || status.notFound()) {
                complete(BuildOutcome.failed("GitHub Pages is not enabled for this repository", attempt));
                return;
            }

            BuildStatus observed = BuildStatus.fromRemote(status.status());
            switch (observed) {
                case SUCCEEDED -> {
                    complete(BuildOutcome.succeeded(status.htmlUrl(), attempt));
                    return;
                }
                case FAILED -> {
                    String reason = status.errorMessage() != null ? status.errorMessage() : "Unknown error";
                    complete(BuildOutcome.failed("Build failed: " + reason, attempt));
                    return;
                }
                default -> {
                    if (observed != previous) {
                        previous = observed;
                        emit(new BuildAttempt(attempt, observed, describe(observed, status.status()), clock.instant()));
                    }
                }
            }

            if (attempt < maxAttempts && !pause(pollInterval)) {
                return;
            }
        }
        complete(BuildOutcome.timedOut(attempts.get()));
    }

    /**
     * Idempotent. Prevents the next poll and suppresses the completion event.
     */
    public void cancel() {
        synchronized (emitLock) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
        }
        cancelSignal.countDown();
        log.info("Cancelled Pages build watch: repo={}, attempts={}", repository, attempts.get());
    }

    /**
     * @return false if the poller was still running when the timeout elapsed
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public int getAttempts() {
        return attempts.get();
    }

    public String getRepository() {
        return repository;
    }

    /**
     * @return the terminal outcome, or null while running or after a cancel
     */
    public BuildOutcome getOutcome() {
        return outcome;
    }

    /**
     * @return true if the full delay elapsed, false if the poller was cancelled meanwhile
     */
    private boolean pause(Duration delay) {
        if (cancelled.get()) {
            return false;
        }
        if (delay.isZero()) {
            return true;
        }
        try {
            return !cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }

    private void emit(BuildAttempt attempt) {
        synchronized (emitLock) {
            if (cancelled.get()) {
                return;
            }
            log.debug("Build status changed: repo={}, attempt={}, status={}", repository, attempt.attempt(), attempt.status());
            try {
                listener.onStatusChanged(repository, attempt);
            } catch (RuntimeException e) {
                log.error("Build status listener failed: repo={}", repository, e);
            }
        }
    }

    private void complete(BuildOutcome result) {
        synchronized (emitLock) {
            if (cancelled.get()) {
                log.debug("Dropping build outcome after cancel: repo={}, status={}", repository, result.status());
                return;
            }
            outcome = result;
            log.info("Pages build watch finished: repo={}, status={}, attempts={}",
                repository, result.status(), result.attempts());
            try {
                listener.onCompleted(repository, result);
            } catch (RuntimeException e) {
                log.error("Build status listener failed on completion: repo={}", repository, e);
            }
        }
    }

    private static String describe(BuildStatus status, String remote) {
        return switch (status) {
            case BUILDING -> "Building...";
            case NOT_STARTED -> "Waiting for build to start...";
            default -> "Status: " + remote;
        };
    }
}
