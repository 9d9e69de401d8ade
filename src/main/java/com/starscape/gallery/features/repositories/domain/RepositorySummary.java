package com.starscape.gallery.features.repositories.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositorySummary(
    String name,
    String description,
    @JsonProperty("html_url") String htmlUrl,
    @JsonProperty("has_pages") boolean hasPages
) {}
