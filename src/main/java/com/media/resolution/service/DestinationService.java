package com.media.resolution.service;

import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.TargetId;

import java.util.List;
import java.util.Optional;

/**
 * The destination catalog's API, as seen by the resolver.
 * Implementations wrap the AniList or MyAnimeList client and throw
 * {@link MediaServiceException} on failure.
 */
public interface DestinationService {

    Optional<MediaEntry> getById(TargetId id);

    List<MediaEntry> searchByTitle(String title);

    /**
     * Finds destination entries that reference {@code foreignId}, the id of the
     * same title in the other catalog.
     *
     * @throws UnsupportedOperationException if {@link #supportsForeignIdLookup()} is false
     */
    default List<MediaEntry> getByForeignId(int foreignId) {
        throw new UnsupportedOperationException("foreign id lookup is not supported");
    }

    default boolean supportsForeignIdLookup() {
        return false;
    }

    /**
     * Writes the progress carried by {@code source} to the destination entry {@code id}.
     */
    void update(TargetId id, MediaEntry source);
}
