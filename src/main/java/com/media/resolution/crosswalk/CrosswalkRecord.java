package com.media.resolution.crosswalk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.media.resolution.core.model.CatalogService;

/**
 * Ids one title carries across catalogs. A record with no ids marks a known miss.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrosswalkRecord(
        @JsonProperty("anilist_id") Integer anilistId,
        @JsonProperty("mal_id") Integer malId,
        @JsonProperty("anidb_id") Integer anidbId,
        @JsonProperty("kitsu_id") Integer kitsuId,
        @JsonProperty("type_str") String type
) {

    public static CrosswalkRecord empty() {
        return new CrosswalkRecord(null, null, null, null, null);
    }

    public static CrosswalkRecord of(int anilistId, int malId) {
        return new CrosswalkRecord(anilistId, malId, null, null, null);
    }

    public int idFor(CatalogService service) {
        Integer id = service == CatalogService.ANILIST ? anilistId : malId;
        return id == null ? 0 : id;
    }

    public boolean isEmpty() {
        return idFor(CatalogService.ANILIST) <= 0 && idFor(CatalogService.MYANIMELIST) <= 0;
    }
}
