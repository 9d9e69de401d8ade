package com.starscape.gallery.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the GitHub content API.
 * Binds to app.github.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.github")
public class GitHubProperties {

    private String apiBase = "https://api.github.com";
    private String org = "lifetime-memories";
    private String token;

    public String getApiBase() {
        return apiBase;
    }

    public void setApiBase(String apiBase) {
        this.apiBase = apiBase;
    }

    public String getOrg() {
        return org;
    }

    public void setOrg(String org) {
        this.org = org;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
