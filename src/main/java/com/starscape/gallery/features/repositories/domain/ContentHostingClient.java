package com.starscape.gallery.features.repositories.domain;

import java.util.List;

/**
 * Read access to the remote content host that stores the family repositories.
 */
public interface ContentHostingClient {

    List<RepositorySummary> listRepositories();

    /**
     * List a directory of a repository. A missing directory yields an empty list.
     */
    List<ContentEntry> listContents(String repository, String path);

    /**
     * Current Pages build status. Never cached; a disabled site yields {@link PagesStatus#notEnabled()}.
     */
    PagesStatus getPagesStatus(String repository);
}
