package com.media.resolution.strategy;

import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.core.model.TargetId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for the map of entries already on the user's destination list.
 */
public final class KnownTargets {
    private static final Logger log = LoggerFactory.getLogger(KnownTargets.class);

    private KnownTargets() {
    }

    /**
     * Indexes targets by destination id. Targets without one are left out.
     */
    public static Map<TargetId, MediaEntry> index(Collection<MediaEntry> targets, SyncDirection direction) {
        Map<TargetId, MediaEntry> byId = new LinkedHashMap<>();
        for (MediaEntry target : targets) {
            TargetId id = direction.targetId(target);
            if (id.isPresent()) {
                byId.putIfAbsent(id, target);
            }
        }
        return byId;
    }

    /**
     * Returns the known entry for an id a lookup produced, logging when the user does not track it.
     */
    static Optional<MediaEntry> existing(Map<TargetId, MediaEntry> knownTargets, TargetId id,
                                         String strategyName, MediaEntry source) {
        MediaEntry target = knownTargets.get(id);
        if (target == null) {
            log.debug("{}: '{}' mapped to id {} but it is not on the user's list",
                    strategyName, source.getTitle(), id);
            return Optional.empty();
        }
        return Optional.of(target);
    }
}
