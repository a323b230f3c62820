package com.media.resolution.crosswalk;

import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaKind;

import java.util.OptionalInt;
import java.util.function.BooleanSupplier;

/**
 * A source of id pairs between the two catalogs.
 */
public interface IdCrosswalk {

    /**
     * Looks up the id in the other catalog for {@code id} in {@code from}.
     *
     * @return the paired id, or empty when this crosswalk has no pair
     * @throws CrosswalkException if the lookup itself failed
     */
    OptionalInt lookup(CatalogService from, MediaKind kind, int id);

    /**
     * Same as {@link #lookup(CatalogService, MediaKind, int)}, for crosswalks that may wait on a
     * remote service: {@code cancelled} is polled between attempts.
     *
     * @throws com.media.resolution.core.ResolutionCancelledException if {@code cancelled} turns true
     */
    default OptionalInt lookup(CatalogService from, MediaKind kind, int id, BooleanSupplier cancelled) {
        return lookup(from, kind, id);
    }

    /**
     * Returns true if this crosswalk can answer for the given kind at all.
     */
    boolean supports(MediaKind kind);

    String getName();
}
