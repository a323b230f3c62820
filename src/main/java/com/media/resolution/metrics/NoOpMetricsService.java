package com.media.resolution.metrics;

import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPassDuration(MediaKind kind, SyncDirection direction, Duration duration) {
    }

    @Override
    public void incrementResolved(String strategyName) {
    }

    @Override
    public void incrementNotFound(MediaKind kind) {
    }

    @Override
    public void incrementConflict(MediaKind kind) {
    }

    @Override
    public void incrementStrategyFailure(String strategyName) {
    }

    @Override
    public void recordMappingCount(int count) {
    }

    @Override
    public void recordCrosswalkCacheHit(String crosswalk) {
    }

    @Override
    public void recordCrosswalkCacheMiss(String crosswalk) {
    }
}
