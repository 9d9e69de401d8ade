package com.starscape.gallery.features.repositories.domain;

/**
 * Pages site status as reported by the hosting API.
 *
 * @param status raw remote status ("built", "building", "errored", ...)
 * @param htmlUrl published site URL, when known
 * @param errorMessage build error reported by the host, if any
 * @param notFound true when the host has no Pages site for the repository
 */
public record PagesStatus(
    String status,
    String htmlUrl,
    String errorMessage,
    boolean notFound
) {

    public static PagesStatus notEnabled() {
        return new PagesStatus("not_enabled", null, null, true);
    }

    public static PagesStatus of(String status, String htmlUrl) {
        return new PagesStatus(status, htmlUrl, null, false);
    }
}
