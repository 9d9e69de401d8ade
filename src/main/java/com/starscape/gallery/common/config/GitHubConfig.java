package com.starscape.gallery.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

@Configuration
public class GitHubConfig {

    private static final Logger log = LoggerFactory.getLogger(GitHubConfig.class);

    @Bean
    public RestClient gitHubRestClient(RestClient.Builder builder, GitHubProperties properties) {
        RestClient.Builder configured = builder.clone()
                .baseUrl(properties.getApiBase())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github.v3+json");

        // Use the token if specified, otherwise fall back to unauthenticated (low quota) access
        if (properties.hasToken()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "token " + properties.getToken());
        } else {
            log.warn("No GitHub token configured; API requests are unauthenticated");
        }
        return configured.build();
    }
}
