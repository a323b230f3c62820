package com.media.resolution.metrics;

import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code media.resolution.pass.duration}: Timer (tags: kind, direction)</li>
 *   <li>{@code media.resolution.resolved}: Counter (tag: strategy)</li>
 *   <li>{@code media.resolution.not_found}: Counter (tag: kind)</li>
 *   <li>{@code media.resolution.conflicts}: Counter (tag: kind)</li>
 *   <li>{@code media.resolution.strategy.failures}: Counter (tag: strategy)</li>
 *   <li>{@code media.resolution.mappings}: DistributionSummary</li>
 *   <li>{@code media.crosswalk.cache.hit} and {@code media.crosswalk.cache.miss}: Counter (tag: crosswalk)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary mappingCountSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mappingCountSummary = DistributionSummary.builder("media.resolution.mappings")
                .description("Kept mappings per pass")
                .register(registry);
    }

    @Override
    public void recordPassDuration(MediaKind kind, SyncDirection direction, Duration duration) {
        String key = kind.name() + ":" + direction.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("media.resolution.pass.duration")
                        .description("Duration of resolution passes")
                        .tag("kind", kind.getLabel())
                        .tag("direction", direction.getLabel())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementResolved(String strategyName) {
        counter("media.resolution.resolved", "Sources resolved per strategy", "strategy", strategyName).increment();
    }

    @Override
    public void incrementNotFound(MediaKind kind) {
        counter("media.resolution.not_found", "Sources without a target", "kind", kind.getLabel()).increment();
    }

    @Override
    public void incrementConflict(MediaKind kind) {
        counter("media.resolution.conflicts", "Duplicate target claims", "kind", kind.getLabel()).increment();
    }

    @Override
    public void incrementStrategyFailure(String strategyName) {
        counter("media.resolution.strategy.failures", "Strategy lookups that failed", "strategy", strategyName)
                .increment();
    }

    @Override
    public void recordMappingCount(int count) {
        mappingCountSummary.record(count);
    }

    @Override
    public void recordCrosswalkCacheHit(String crosswalk) {
        counter("media.crosswalk.cache.hit", "Crosswalk cache hits", "crosswalk", crosswalk).increment();
    }

    @Override
    public void recordCrosswalkCacheMiss(String crosswalk) {
        counter("media.crosswalk.cache.miss", "Crosswalk cache misses", "crosswalk", crosswalk).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
