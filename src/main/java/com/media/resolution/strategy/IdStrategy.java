package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.TargetId;

import java.util.Map;
import java.util.Optional;

/**
 * Matches when the foreign id the source already carries is on the user's destination list.
 */
public class IdStrategy implements MatchStrategy {

    public static final String NAME = "IdStrategy";

    @Override
    public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                           ResolutionContext context) {
        TargetId id = context.getDirection().targetId(source);
        if (!id.isPresent()) {
            return Optional.empty();
        }
        return Optional.ofNullable(knownTargets.get(id));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
