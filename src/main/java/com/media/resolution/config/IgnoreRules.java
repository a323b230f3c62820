package com.media.resolution.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sources to leave out of resolution, by id in either catalog or by title.
 * Titles compare case-insensitively.
 */
public record IgnoreRules(
        @JsonProperty("anilist_ids") List<Integer> anilistIds,
        @JsonProperty("mal_ids") List<Integer> malIds,
        @JsonProperty("titles") List<String> titles
) {
    public IgnoreRules {
        anilistIds = anilistIds == null ? List.of() : List.copyOf(anilistIds);
        malIds = malIds == null ? List.of() : List.copyOf(malIds);
        titles = titles == null ? List.of() : List.copyOf(titles);
    }

    public static IgnoreRules none() {
        return new IgnoreRules(List.of(), List.of(), List.of());
    }
}
