package com.media.resolution.core.model;

/**
 * Discriminant for the two kinds of tracked media.
 * ANIME entries count episodes, MANGA entries count chapters and volumes.
 */
public enum MediaKind {
    ANIME("anime"),
    MANGA("manga");

    private final String label;

    MediaKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
