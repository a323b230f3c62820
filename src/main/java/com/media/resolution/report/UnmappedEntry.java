package com.media.resolution.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.SyncDirection;

/**
 * A source entry that produced no applicable mapping in the last pass.
 */
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public record UnmappedEntry(
        @JsonProperty("anilist_id") int anilistId,
        @JsonProperty("mal_id") int malId,
        @JsonProperty("title") String title,
        @JsonProperty("media_type") String mediaType,
        @JsonProperty("direction") String direction,
        @JsonProperty("reason") String reason
) {

    public static UnmappedEntry of(MediaEntry source, SyncDirection direction, String reason) {
        return new UnmappedEntry(
                source.getAnilistId(),
                source.getMalId(),
                source.getTitle(),
                source.getKind().getLabel(),
                direction.getLabel(),
                reason);
    }
}
