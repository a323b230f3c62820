package com.media.resolution.api;

import com.media.resolution.core.model.Conflict;
import com.media.resolution.core.model.ResolvedMapping;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.similarity.TitleMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps one mapping per target when several sources resolved to the same target.
 *
 * <p>Within a group the winner is the mapping from the highest-priority strategy (lowest
 * index). Ties go to a source whose title equals the target's ignoring case, then to the
 * lower source ids and title, so the outcome does not depend on input order.</p>
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final Comparator<ResolvedMapping> priority;

    public Deduplicator(TitleMatcher titleMatcher) {
        Objects.requireNonNull(titleMatcher, "titleMatcher is required");
        this.priority = Comparator
                .comparingInt(ResolvedMapping::strategyIndex)
                .thenComparing(m -> !titleMatcher.identicalTitleIgnoreCase(m.source(), m.target()))
                .thenComparingInt(m -> m.source().getAnilistId())
                .thenComparingInt(m -> m.source().getMalId())
                .thenComparing(m -> m.source().getTitle());
    }

    public Result deduplicate(List<ResolvedMapping> mappings) {
        Map<TargetId, List<ResolvedMapping>> groups = new LinkedHashMap<>();
        for (ResolvedMapping mapping : mappings) {
            groups.computeIfAbsent(mapping.targetId(), id -> new ArrayList<>()).add(mapping);
        }

        List<ResolvedMapping> kept = new ArrayList<>(groups.size());
        List<Conflict> conflicts = new ArrayList<>();
        for (List<ResolvedMapping> group : groups.values()) {
            if (group.size() == 1) {
                kept.add(group.get(0));
                continue;
            }
            List<ResolvedMapping> ranked = new ArrayList<>(group);
            ranked.sort(priority);
            ResolvedMapping winner = ranked.get(0);
            kept.add(winner);
            for (ResolvedMapping loser : ranked.subList(1, ranked.size())) {
                Conflict conflict = new Conflict(loser, winner);
                log.debug("dedup.conflict target={} winner='{}' via {} loser='{}' via {}",
                        conflict.targetId(), conflict.winnerTitle(), conflict.winnerStrategy(),
                        conflict.loserTitle(), conflict.loserStrategy());
                conflicts.add(conflict);
            }
        }
        return new Result(List.copyOf(kept), List.copyOf(conflicts));
    }

    /**
     * Mappings to apply, one per target, and the claims that lost.
     */
    public record Result(List<ResolvedMapping> kept, List<Conflict> conflicts) {
    }
}
