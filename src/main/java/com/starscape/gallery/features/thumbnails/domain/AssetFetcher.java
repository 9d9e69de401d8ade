package com.starscape.gallery.features.thumbnails.domain;

import java.io.IOException;

/**
 * Downloads the raw bytes of a remote asset.
 */
@FunctionalInterface
public interface AssetFetcher {

    byte[] fetch(String url) throws IOException;
}
