package com.starscape.gallery.features.repositories.api;

import com.starscape.gallery.common.cache.CacheStats;
import com.starscape.gallery.features.repositories.api.dto.GalleryResponse;
import com.starscape.gallery.features.repositories.app.GalleryService;
import com.starscape.gallery.features.repositories.domain.RepositorySummary;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@Validated
public class RepositoryController {

    private final GalleryService galleryService;

    public RepositoryController(GalleryService galleryService) {
        this.galleryService = galleryService;
    }

    @GetMapping("/repos")
    public ResponseEntity<List<RepositorySummary>> listRepositories() {
        return ResponseEntity.ok(galleryService.listRepositories());
    }

    /**
     * Load every thumbnail of the repository and lay them out for the given container width.
     */
    @GetMapping("/repos/{repo}/gallery")
    public ResponseEntity<GalleryResponse> gallery(
            @PathVariable String repo,
            @RequestParam(defaultValue = "800") @Positive(message = "Width must be positive") int width) throws InterruptedException {
        return ResponseEntity.ok(galleryService.loadGallery(repo, width));
    }

    @DeleteMapping("/repos/{repo}/cache")
    public ResponseEntity<Void> invalidateCache(@PathVariable String repo) {
        galleryService.invalidate(repo);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidateAllCaches() {
        galleryService.invalidateAll();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(galleryService.cacheStats());
    }
}
