package com.media.resolution.core.model;

import java.util.Objects;

/**
 * A source entry paired with the target the strategy chain found for it.
 *
 * @param source        the source entry
 * @param target        the resolved destination entry
 * @param targetId      destination id the mapping claims
 * @param strategyName  name of the strategy that produced the match
 * @param strategyIndex position of that strategy in the chain, lower wins
 */
public record ResolvedMapping(
        MediaEntry source,
        MediaEntry target,
        TargetId targetId,
        String strategyName,
        int strategyIndex
) {
    public ResolvedMapping {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(strategyName, "strategyName is required");
        if (strategyIndex < 0) {
            throw new IllegalArgumentException("strategyIndex must be >= 0");
        }
    }
}
