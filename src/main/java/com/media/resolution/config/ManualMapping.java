package com.media.resolution.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator-supplied pair of ids that denote the same title.
 */
public record ManualMapping(
        @JsonProperty("anilist_id") int anilistId,
        @JsonProperty("mal_id") int malId,
        @JsonProperty("comment") String comment
) {
}
