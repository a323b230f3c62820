package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.report.MatchWarning;
import com.media.resolution.similarity.TitleMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Refuses title-based matches that are likely wrong.
 *
 * <p>A candidate is refused when both entries carry destination ids and they differ, or,
 * for anime, when the candidate looks like the main series of a special, OVA or movie.</p>
 */
public class MatchGuard {
    private static final Logger log = LoggerFactory.getLogger(MatchGuard.class);

    /** Specials, OVAs and movies list at most this many episodes. */
    static final int SPECIAL_MAX_EPISODES = 1;
    /** A series lists more episodes than this. */
    static final int SERIES_MIN_EPISODES_EXCLUSIVE = 4;

    static final String REASON_NO_MAL_ID = "different titles (source has no MAL ID, target has different MAL ID)";
    static final String REASON_SPECIAL_VS_SERIES = "episode count mismatch (special vs series)";

    private final TitleMatcher titleMatcher;

    public MatchGuard(TitleMatcher titleMatcher) {
        this.titleMatcher = Objects.requireNonNull(titleMatcher, "titleMatcher is required");
    }

    /**
     * Returns true if {@code target} must not be accepted for {@code source}.
     * Heuristic refusals are reported to the context's sink.
     */
    public boolean shouldReject(MediaEntry source, MediaEntry target, ResolutionContext context) {
        TargetId sourceForeign = context.getDirection().targetId(source);
        TargetId targetId = context.getDirection().targetId(target);
        if (sourceForeign.isPresent() && targetId.isPresent() && !sourceForeign.equals(targetId)) {
            log.debug("Rejecting '{}' for '{}': ids differ ({} vs {})",
                    target.getTitle(), source.getTitle(), sourceForeign, targetId);
            return true;
        }

        if (source.getKind() != MediaKind.ANIME) {
            return false;
        }
        Optional<String> reason = incorrectMatchReason(source, target);
        if (reason.isEmpty()) {
            return false;
        }
        String detail = String.format("(%d vs %d)", source.getTotalUnits(), target.getTotalUnits());
        log.debug("Rejecting '{}' for '{}': {} {}", target.getTitle(), source.getTitle(), reason.get(), detail);
        context.getReportSink().onWarning(new MatchWarning(source.getTitle(), reason.get(), detail, source.getKind()));
        return true;
    }

    public boolean isPotentiallyIncorrectMatch(MediaEntry source, MediaEntry target) {
        return incorrectMatchReason(source, target).isPresent();
    }

    /**
     * Anime heuristics. Agreeing MAL ids or an identical title always pass.
     */
    Optional<String> incorrectMatchReason(MediaEntry source, MediaEntry target) {
        if (source.getMalId() > 0 && source.getMalId() == target.getMalId()) {
            return Optional.empty();
        }
        if (titleMatcher.identicalTitle(source, target)) {
            return Optional.empty();
        }
        if (source.getMalId() == 0 && target.getMalId() > 0) {
            return Optional.of(REASON_NO_MAL_ID);
        }
        if (source.getTotalUnits() <= SPECIAL_MAX_EPISODES
                && target.getTotalUnits() > SERIES_MIN_EPISODES_EXCLUSIVE) {
            return Optional.of(REASON_SPECIAL_VS_SERIES);
        }
        return Optional.empty();
    }
}
