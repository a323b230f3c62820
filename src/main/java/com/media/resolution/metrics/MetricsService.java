package com.media.resolution.metrics;

import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;

import java.time.Duration;

/**
 * Interface for recording resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordPassDuration(MediaKind kind, SyncDirection direction, Duration duration);

    void incrementResolved(String strategyName);

    void incrementNotFound(MediaKind kind);

    void incrementConflict(MediaKind kind);

    void incrementStrategyFailure(String strategyName);

    void recordMappingCount(int count);

    void recordCrosswalkCacheHit(String crosswalk);

    void recordCrosswalkCacheMiss(String crosswalk);
}
