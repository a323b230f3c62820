package com.media.resolution.crosswalk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.metrics.MetricsService;
import com.media.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BooleanSupplier;

/**
 * Client for the Hato id service ({@code https://hato.malupdaterosx.moe}). Anime and manga.
 *
 * <p>Backed by a persisted {@link CrosswalkCache}: hits never reach the network and a miss
 * reported by the service is stored as an empty record, so it is not asked again.</p>
 */
public class HatoClient extends HttpCrosswalkClient {
    private static final Logger log = LoggerFactory.getLogger(HatoClient.class);

    public static final String DEFAULT_BASE_URL = "https://hato.malupdaterosx.moe";

    private final CrosswalkCache cache;
    private final MetricsService metrics;

    public HatoClient(CrosswalkCache cache) {
        this(HttpSettings.of(DEFAULT_BASE_URL), cache, new NoOpMetricsService());
    }

    public HatoClient(HttpSettings settings, CrosswalkCache cache, MetricsService metrics) {
        super(settings);
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    @Override
    public OptionalInt lookup(CatalogService from, MediaKind kind, int id) {
        return lookup(from, kind, id, () -> false);
    }

    @Override
    public OptionalInt lookup(CatalogService from, MediaKind kind, int id, BooleanSupplier cancelled) {
        if (id <= 0) {
            return OptionalInt.empty();
        }
        CatalogService to = from == CatalogService.ANILIST ? CatalogService.MYANIMELIST : CatalogService.ANILIST;

        Optional<CrosswalkRecord> cached = cache.get(from, kind, id);
        CrosswalkRecord record;
        if (cached.isPresent()) {
            metrics.recordCrosswalkCacheHit(getName());
            record = cached.get();
        } else {
            metrics.recordCrosswalkCacheMiss(getName());
            String path = String.format("/api/mappings/%s/%s/%d", from.getKey(), kind.getLabel(), id);
            record = getJson(path, HatoResponse.class, cancelled)
                    .map(HatoResponse::data)
                    .filter(data -> data.idFor(to) > 0)
                    .orElse(CrosswalkRecord.empty());
            cache.put(from, kind, id, record);
        }

        int paired = record.idFor(to);
        log.debug("hato.lookup from={} kind={} id={} paired={} cached={}",
                from.getKey(), kind.getLabel(), id, paired, cached.isPresent());
        return paired > 0 ? OptionalInt.of(paired) : OptionalInt.empty();
    }

    @Override
    public boolean supports(MediaKind kind) {
        return true;
    }

    @Override
    public String getName() {
        return "hato";
    }

    /**
     * Persists lookups made since the cache was loaded.
     */
    public boolean saveCache() {
        return cache.save();
    }

    @Override
    protected HttpRequest.Builder decorate(HttpRequest.Builder request) {
        return request.header("User-Agent", "Mozilla/5.0");
    }

    record HatoResponse(@JsonProperty("data") CrosswalkRecord data) {
    }
}
