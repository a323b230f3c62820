package com.media.resolution.core.model;

/**
 * The two catalogs being reconciled, with the path segment used by crosswalk services.
 */
public enum CatalogService {
    ANILIST("anilist"),
    MYANIMELIST("mal");

    private final String key;

    CatalogService(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
