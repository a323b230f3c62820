package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.crosswalk.CrosswalkException;
import com.media.resolution.crosswalk.IdCrosswalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Translates the source id through an {@link IdCrosswalk}, then matches like {@link IdStrategy}.
 *
 * <p>Crosswalk services are best effort: a failed lookup is logged and treated as no answer,
 * so an unreachable service never aborts the chain.</p>
 */
public class CrosswalkStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(CrosswalkStrategy.class);

    public static final String OFFLINE_DATABASE = "OfflineDatabaseStrategy";
    public static final String ARM_API = "ArmApiStrategy";
    public static final String HATO_API = "HatoApiStrategy";

    private final String name;
    private final IdCrosswalk crosswalk;

    public CrosswalkStrategy(String name, IdCrosswalk crosswalk) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.crosswalk = Objects.requireNonNull(crosswalk, "crosswalk is required");
    }

    @Override
    public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                           ResolutionContext context) {
        if (!crosswalk.supports(source.getKind())) {
            return Optional.empty();
        }
        SyncDirection direction = context.getDirection();
        int sourceId = direction.sourceId(source);
        if (sourceId <= 0) {
            return Optional.empty();
        }

        context.throwIfCancelled(name + " lookup");

        OptionalInt paired;
        try {
            paired = crosswalk.lookup(direction.getSource(), source.getKind(), sourceId, context::isCancelled);
        } catch (CrosswalkException e) {
            log.debug("{}: lookup for '{}' ({}) failed: {}", name, source.getTitle(), sourceId, e.getMessage());
            return Optional.empty();
        }
        if (paired.isEmpty()) {
            return Optional.empty();
        }
        return KnownTargets.existing(knownTargets, TargetId.of(paired.getAsInt()), name, source);
    }

    @Override
    public String getName() {
        return name;
    }

    public IdCrosswalk getCrosswalk() {
        return crosswalk;
    }
}
