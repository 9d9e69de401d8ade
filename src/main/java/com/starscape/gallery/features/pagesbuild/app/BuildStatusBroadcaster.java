package com.starscape.gallery.features.pagesbuild.app;

import com.starscape.gallery.features.pagesbuild.api.dto.BuildStatusUpdate;
import com.starscape.gallery.features.pagesbuild.domain.BuildAttempt;
import com.starscape.gallery.features.pagesbuild.domain.BuildOutcome;
import com.starscape.gallery.features.pagesbuild.domain.BuildStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Broadcasts build watch events to subscribers of {@code /topic/build/{repository}}.
 */
@Service
public class BuildStatusBroadcaster implements BuildStatusListener {

    private static final Logger log = LoggerFactory.getLogger(BuildStatusBroadcaster.class);

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    public BuildStatusBroadcaster(SimpMessagingTemplate messagingTemplate, Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.clock = clock;
    }

    public static String destination(String repository) {
        return "/topic/build/" + repository;
    }

    @Override
    public void onStatusChanged(String repository, BuildAttempt attempt) {
        BuildStatusUpdate update = new BuildStatusUpdate(
            repository,
            attempt.status().name(),
            attempt.message(),
            attempt.attempt(),
            null,
            false,
            attempt.observedAt()
        );
        messagingTemplate.convertAndSend(destination(repository), update);
        log.debug("Broadcasted build status to {}: status={}, attempt={}",
            destination(repository), update.status(), update.attempt());
    }

    @Override
    public void onCompleted(String repository, BuildOutcome outcome) {
        BuildStatusUpdate update = new BuildStatusUpdate(
            repository,
            outcome.status().name(),
            outcome.message(),
            outcome.attempts(),
            outcome.url(),
            true,
            clock.instant()
        );
        messagingTemplate.convertAndSend(destination(repository), update);
        log.info("Broadcasted build completion to {}: status={}, attempts={}",
            destination(repository), update.status(), update.attempt());
    }
}
