package com.starscape.gallery.features.repositories.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.gallery.common.config.GitHubProperties;
import com.starscape.gallery.common.exception.RemoteApiException;
import com.starscape.gallery.features.ratelimit.app.RateLimitTracker;
import com.starscape.gallery.features.repositories.app.GalleryCache;
import com.starscape.gallery.features.repositories.domain.ContentEntry;
import com.starscape.gallery.features.repositories.domain.ContentHostingClient;
import com.starscape.gallery.features.repositories.domain.PagesStatus;
import com.starscape.gallery.features.repositories.domain.RepositorySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;

/**
 * GitHub implementation of {@link ContentHostingClient}.
 *
 * Listings are served from {@link GalleryCache} when possible; Pages status is always
 * fetched fresh. Every response updates the {@link RateLimitTracker}.
 */
@Component
public class GitHubContentClient implements ContentHostingClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubContentClient.class);

    private static final ParameterizedTypeReference<List<RepositorySummary>> REPOSITORY_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<ContentEntry>> CONTENT_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final String org;
    private final RateLimitTracker rateLimitTracker;
    private final GalleryCache cache;

    @Autowired
    public GitHubContentClient(
            RestClient gitHubRestClient,
            GitHubProperties properties,
            RateLimitTracker rateLimitTracker,
            GalleryCache cache) {
        this(gitHubRestClient, properties.getOrg(), rateLimitTracker, cache);
    }

    public GitHubContentClient(RestClient restClient, String org, RateLimitTracker rateLimitTracker, GalleryCache cache) {
        this.restClient = restClient;
        this.org = org;
        this.rateLimitTracker = rateLimitTracker;
        this.cache = cache;
    }

    @Override
    public List<RepositorySummary> listRepositories() {
        Optional<List<RepositorySummary>> cached = cache.getRepositories();
        if (cached.isPresent()) {
            return cached.get();
        }

        List<RepositorySummary> repositories = restClient.get()
                .uri("/orgs/{org}/repos", org)
                .exchange((request, response) -> {
                    rateLimitTracker.record(response.getHeaders());
                    if (response.getStatusCode().value() != HttpStatus.OK.value()) {
                        throw new RemoteApiException("fetch repositories", response.getStatusCode().value());
                    }
                    List<RepositorySummary> body = response.bodyTo(REPOSITORY_LIST);
                    return body != null ? body : List.<RepositorySummary>of();
                });

        log.info("Fetched {} repositories for {}", repositories.size(), org);
        cache.putRepositories(repositories);
        return repositories;
    }

    @Override
    public List<ContentEntry> listContents(String repository, String path) {
        String normalizedPath = path == null ? "" : path;
        Optional<List<ContentEntry>> cached = cache.getContents(repository, normalizedPath);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<ContentEntry> contents = restClient.get()
                // the path is appended as-is so nested directories keep their slashes
                .uri("/repos/{org}/{repo}/contents/" + normalizedPath, org, repository)
                .exchange((request, response) -> {
                    rateLimitTracker.record(response.getHeaders());
                    int status = response.getStatusCode().value();
                    if (status == HttpStatus.NOT_FOUND.value()) {
                        log.info("Path not found in {}: '{}'", repository, normalizedPath);
                        return List.<ContentEntry>of();
                    }
                    if (status != HttpStatus.OK.value()) {
                        throw new RemoteApiException("get repository contents", status);
                    }
                    List<ContentEntry> body = response.bodyTo(CONTENT_LIST);
                    return body != null ? body : List.<ContentEntry>of();
                });

        log.debug("Listed {} entries in {}/{}", contents.size(), repository, normalizedPath);
        cache.putContents(repository, normalizedPath, contents);
        return contents;
    }

    @Override
    public PagesStatus getPagesStatus(String repository) {
        return restClient.get()
                .uri("/repos/{org}/{repo}/pages", org, repository)
                .exchange((request, response) -> {
                    rateLimitTracker.record(response.getHeaders());
                    int status = response.getStatusCode().value();
                    if (status == HttpStatus.NOT_FOUND.value()) {
                        return PagesStatus.notEnabled();
                    }
                    if (status != HttpStatus.OK.value()) {
                        throw new RemoteApiException("get GitHub Pages status", status);
                    }
                    JsonNode body = response.bodyTo(JsonNode.class);
                    return toPagesStatus(body);
                });
    }

    private static PagesStatus toPagesStatus(JsonNode body) {
        if (body == null) {
            return PagesStatus.of(null, null);
        }
        return new PagesStatus(
            text(body.get("status")),
            text(body.get("html_url")),
            errorMessage(body.get("error")),
            false
        );
    }

    private static String errorMessage(JsonNode error) {
        if (error == null || error.isNull()) {
            return null;
        }
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode message = error.get("message");
        return message != null && !message.isNull() ? message.asText() : error.toString();
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
