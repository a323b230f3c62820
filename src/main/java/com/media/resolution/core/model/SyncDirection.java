package com.media.resolution.core.model;

/**
 * Direction of a synchronization pass. The direction decides which of an
 * entry's two ids is its origin id and which is its destination id.
 */
public enum SyncDirection {
    /** AniList to MyAnimeList. */
    FORWARD("forward", CatalogService.ANILIST, CatalogService.MYANIMELIST),
    /** MyAnimeList to AniList. */
    REVERSE("reverse", CatalogService.MYANIMELIST, CatalogService.ANILIST);

    private final String label;
    private final CatalogService source;
    private final CatalogService destination;

    SyncDirection(String label, CatalogService source, CatalogService destination) {
        this.label = label;
        this.source = source;
        this.destination = destination;
    }

    public String getLabel() {
        return label;
    }

    public CatalogService getSource() {
        return source;
    }

    public CatalogService getDestination() {
        return destination;
    }

    /**
     * Returns the id the entry carries in the source catalog.
     */
    public int sourceId(MediaEntry entry) {
        return entry.idIn(source);
    }

    /**
     * Returns the id the entry carries in the destination catalog.
     * For a source entry this is its foreign id; for a target entry it is its address.
     */
    public TargetId targetId(MediaEntry entry) {
        return TargetId.of(entry.idIn(destination));
    }
}
