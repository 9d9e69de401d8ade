package com.starscape.gallery.features.repositories.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a repository directory listing as returned by the contents API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentEntry(
    String name,
    String path,
    long size,
    String type,
    @JsonProperty("download_url") String downloadUrl
) {

    public boolean isFile() {
        return "file".equals(type);
    }
}
