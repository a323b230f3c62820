package com.media.resolution.core.model;

/**
 * Normalized list status shared by both catalogs.
 * CURRENT covers "watching" for anime and "reading" for manga.
 */
public enum ListStatus {
    CURRENT("watching", "reading"),
    COMPLETED("completed", "completed"),
    ON_HOLD("on_hold", "on_hold"),
    DROPPED("dropped", "dropped"),
    PLANNING("plan_to_watch", "plan_to_read"),
    REPEATING("rewatching", "repeating");

    private final String animeLabel;
    private final String mangaLabel;

    ListStatus(String animeLabel, String mangaLabel) {
        this.animeLabel = animeLabel;
        this.mangaLabel = mangaLabel;
    }

    public String labelFor(MediaKind kind) {
        return kind == MediaKind.MANGA ? mangaLabel : animeLabel;
    }
}
