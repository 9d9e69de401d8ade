package com.starscape.gallery.features.repositories.app;

import com.starscape.gallery.common.cache.CacheStats;
import com.starscape.gallery.common.cache.TtlCache;
import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.repositories.domain.ContentEntry;
import com.starscape.gallery.features.repositories.domain.RepositorySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Repository-aware view over the shared {@link TtlCache}.
 *
 * Keys are composed as {@code namespace:repository:id}, so everything cached for one
 * repository can be dropped (for example after an upload) without touching other
 * repositories or the global repository list.
 */
@Component
public class GalleryCache {

    private static final Logger log = LoggerFactory.getLogger(GalleryCache.class);

    static final String REPO_LIST_KEY = "repo_list";
    static final String CONTENTS_NAMESPACE = "repo_contents";
    static final String THUMBNAILS_NAMESPACE = "thumbnails";

    private static final List<String> REPOSITORY_NAMESPACES = List.of(CONTENTS_NAMESPACE, THUMBNAILS_NAMESPACE);

    private final TtlCache<Object> cache;
    private final Duration repositoryListTtl;
    private final Duration contentsTtl;
    private final Duration thumbnailTtl;

    public GalleryCache(TtlCache<Object> cache, GalleryProperties properties) {
        this.cache = cache;
        this.repositoryListTtl = properties.getCache().getRepositoryListTtl();
        this.contentsTtl = properties.getCache().getContentsTtl();
        this.thumbnailTtl = properties.getCache().getThumbnailTtl();
    }

    @SuppressWarnings("unchecked")
    public Optional<List<RepositorySummary>> getRepositories() {
        return cache.get(REPO_LIST_KEY).map(value -> (List<RepositorySummary>) value);
    }

    public void putRepositories(List<RepositorySummary> repositories) {
        cache.put(REPO_LIST_KEY, List.copyOf(repositories), repositoryListTtl);
    }

    @SuppressWarnings("unchecked")
    public Optional<List<ContentEntry>> getContents(String repository, String path) {
        return cache.get(key(CONTENTS_NAMESPACE, repository, path)).map(value -> (List<ContentEntry>) value);
    }

    public void putContents(String repository, String path, List<ContentEntry> contents) {
        cache.put(key(CONTENTS_NAMESPACE, repository, path), List.copyOf(contents), contentsTtl);
    }

    public Optional<byte[]> getThumbnail(String repository, String path) {
        return cache.get(key(THUMBNAILS_NAMESPACE, repository, path)).map(byte[].class::cast);
    }

    public void putThumbnail(String repository, String path, byte[] bytes) {
        cache.put(key(THUMBNAILS_NAMESPACE, repository, path), bytes, thumbnailTtl);
    }

    /**
     * Drop every entry belonging to one repository, in every namespace.
     * @return the number of entries removed
     */
    public int invalidateRepository(String repository) {
        List<String> prefixes = REPOSITORY_NAMESPACES.stream()
                .map(namespace -> namespace + ":" + repository + ":")
                .toList();
        int removed = cache.invalidateIf(key -> prefixes.stream().anyMatch(key::startsWith));
        log.debug("Invalidated cache for repository: {} ({} entries)", repository, removed);
        return removed;
    }

    /**
     * Drop the repository list and every per-repository entry.
     */
    public int invalidateAll() {
        int removed = cache.invalidateIf(key -> key.equals(REPO_LIST_KEY)
                || REPOSITORY_NAMESPACES.stream().anyMatch(namespace -> key.startsWith(namespace + ":")));
        log.debug("Invalidated all repository cache ({} entries)", removed);
        return removed;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    static String key(String namespace, String repository, String id) {
        return namespace + ":" + repository + ":" + (id == null ? "" : id);
    }
}
