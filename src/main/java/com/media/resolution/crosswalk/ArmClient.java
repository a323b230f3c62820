package com.media.resolution.crosswalk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalInt;
import java.util.function.BooleanSupplier;

/**
 * Client for the ARM id service ({@code https://arm.haglund.dev}). Anime only.
 * Answers, including misses, are memoized in memory for the lifetime of the client.
 */
public class ArmClient extends HttpCrosswalkClient {
    private static final Logger log = LoggerFactory.getLogger(ArmClient.class);

    public static final String DEFAULT_BASE_URL = "https://arm.haglund.dev";

    private final Cache<String, CrosswalkRecord> memo;

    public ArmClient() {
        this(HttpSettings.of(DEFAULT_BASE_URL), CacheConfig.defaults());
    }

    public ArmClient(HttpSettings settings, CacheConfig cacheConfig) {
        super(settings);
        this.memo = cacheConfig.enabled()
                ? Caffeine.newBuilder()
                    .maximumSize(cacheConfig.maxSize())
                    .expireAfterWrite(Duration.ofSeconds(cacheConfig.ttlSeconds()))
                    .build()
                : null;
    }

    @Override
    public OptionalInt lookup(CatalogService from, MediaKind kind, int id) {
        return lookup(from, kind, id, () -> false);
    }

    @Override
    public OptionalInt lookup(CatalogService from, MediaKind kind, int id, BooleanSupplier cancelled) {
        if (kind != MediaKind.ANIME || id <= 0) {
            return OptionalInt.empty();
        }
        CatalogService to = from == CatalogService.ANILIST ? CatalogService.MYANIMELIST : CatalogService.ANILIST;
        String key = from.getKey() + "_" + id;

        CrosswalkRecord record = memo != null ? memo.getIfPresent(key) : null;
        if (record == null) {
            String path = String.format("/api/v2/ids?source=%s&id=%d&include=%s", param(from), id, param(to));
            record = getJson(path, ArmResponse.class, cancelled)
                    .map(ArmResponse::toRecord)
                    .orElse(CrosswalkRecord.empty());
            if (memo != null) {
                memo.put(key, record);
            }
        }

        int paired = record.idFor(to);
        log.debug("arm.lookup from={} id={} paired={}", from.getKey(), id, paired);
        return paired > 0 ? OptionalInt.of(paired) : OptionalInt.empty();
    }

    @Override
    public boolean supports(MediaKind kind) {
        return kind == MediaKind.ANIME;
    }

    @Override
    public String getName() {
        return "arm";
    }

    private static String param(CatalogService service) {
        return service == CatalogService.ANILIST ? "anilist" : "myanimelist";
    }

    record ArmResponse(
            @JsonProperty("anilist") Integer anilist,
            @JsonProperty("myanimelist") Integer myanimelist,
            @JsonProperty("anidb") Integer anidb,
            @JsonProperty("kitsu") Integer kitsu
    ) {
        CrosswalkRecord toRecord() {
            return new CrosswalkRecord(anilist, myanimelist, anidb, kitsu, "anime");
        }
    }
}
