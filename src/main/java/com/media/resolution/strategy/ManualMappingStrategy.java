package com.media.resolution.strategy;

import com.media.resolution.config.MappingsConfig;
import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.core.model.TargetId;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Applies the operator's manual id pairs. A pair whose target is not on the user's
 * list is not a match.
 */
public class ManualMappingStrategy implements MatchStrategy {

    public static final String NAME = "ManualMappingStrategy";

    private final MappingsConfig mappings;

    public ManualMappingStrategy(MappingsConfig mappings) {
        this.mappings = Objects.requireNonNull(mappings, "mappings is required");
    }

    @Override
    public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                           ResolutionContext context) {
        SyncDirection direction = context.getDirection();
        int sourceId = direction.sourceId(source);
        if (sourceId <= 0) {
            return Optional.empty();
        }
        OptionalInt mapped = mappings.manualMapping(direction.getDestination(), sourceId);
        if (mapped.isEmpty()) {
            return Optional.empty();
        }
        return KnownTargets.existing(knownTargets, TargetId.of(mapped.getAsInt()), NAME, source);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
