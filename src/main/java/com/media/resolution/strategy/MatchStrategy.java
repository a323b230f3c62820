package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.TargetId;

import java.util.Map;
import java.util.Optional;

/**
 * One way of finding the destination entry for a source entry.
 *
 * <p>Implementations return empty when they have no answer. They throw when the
 * lookup behind them failed, and throw
 * {@link com.media.resolution.core.ResolutionCancelledException} when the run was
 * cancelled before a network call.</p>
 */
public interface MatchStrategy {

    /**
     * @param source       the entry to resolve
     * @param knownTargets entries already on the user's destination list, by destination id
     * @param context      run context carrying direction and cancellation
     * @return the matched target, or empty
     */
    Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                    ResolutionContext context);

    String getName();
}
