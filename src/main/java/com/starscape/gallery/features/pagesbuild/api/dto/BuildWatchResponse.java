package com.starscape.gallery.features.pagesbuild.api.dto;

public record BuildWatchResponse(
    String repository,
    boolean watching,
    String topic
) {}
