package com.starscape.gallery.features.thumbnails.infra;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.features.thumbnails.domain.AssetFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Downloads raw asset bytes (thumbnail download URLs) with a bounded connect and read timeout.
 */
@Component
public class HttpAssetFetcher implements AssetFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpAssetFetcher.class);

    private final RestClient restClient;

    public HttpAssetFetcher(RestClient.Builder restClientBuilder, GalleryProperties properties) {
        Duration timeout = properties.getFetch().getTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        this.restClient = restClientBuilder.clone()
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public byte[] fetch(String url) throws IOException {
        if (url == null || url.isBlank()) {
            throw new IOException("Asset has no download URL");
        }
        try {
            byte[] body = restClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .body(byte[].class);
            log.debug("Downloaded asset: url={}, bytes={}", url, body == null ? 0 : body.length);
            return body;
        } catch (RestClientException e) {
            throw new IOException("Failed to download " + url + ": " + e.getMessage(), e);
        }
    }
}
