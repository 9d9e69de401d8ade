package com.starscape.gallery.features.pagesbuild.api;

import com.starscape.gallery.common.exception.NotFoundException;
import com.starscape.gallery.features.pagesbuild.api.dto.BuildWatchResponse;
import com.starscape.gallery.features.pagesbuild.app.BuildStatusBroadcaster;
import com.starscape.gallery.features.pagesbuild.app.BuildWatchService;
import com.starscape.gallery.features.repositories.app.RepositoryNames;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Starts and stops Pages build watches. Progress is pushed over STOMP on the returned topic.
 */
@RestController
@RequestMapping("/api/repos/{repo}/build-watch")
public class BuildWatchController {

    private final BuildWatchService buildWatchService;

    public BuildWatchController(BuildWatchService buildWatchService) {
        this.buildWatchService = buildWatchService;
    }

    @PostMapping
    public ResponseEntity<BuildWatchResponse> start(@PathVariable String repo) throws InterruptedException {
        String name = RepositoryNames.validate(repo);
        buildWatchService.startWatching(name);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response(name, true));
    }

    @DeleteMapping
    public ResponseEntity<Void> stop(@PathVariable String repo) throws InterruptedException {
        String name = RepositoryNames.validate(repo);
        if (!buildWatchService.stopWatching(name)) {
            throw new NotFoundException("No build watch running for " + name);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public ResponseEntity<BuildWatchResponse> status(@PathVariable String repo) {
        String name = RepositoryNames.validate(repo);
        return ResponseEntity.ok(response(name, buildWatchService.isWatching(name)));
    }

    private static BuildWatchResponse response(String repository, boolean watching) {
        return new BuildWatchResponse(repository, watching, BuildStatusBroadcaster.destination(repository));
    }
}
