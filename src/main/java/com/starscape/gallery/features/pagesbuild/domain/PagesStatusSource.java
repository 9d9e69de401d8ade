package com.starscape.gallery.features.pagesbuild.domain;

import com.starscape.gallery.features.repositories.domain.PagesStatus;

@FunctionalInterface
public interface PagesStatusSource {

    PagesStatus fetch(String repository);
}
