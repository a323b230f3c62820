package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.similarity.TitleMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches the source against the user's destination list by title.
 *
 * <p>Candidates are visited sorted by title, then destination id. An exact primary-title
 * match wins outright; otherwise the first fuzzy title and type match that the
 * {@link MatchGuard} does not refuse is returned.</p>
 */
public class TitleStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(TitleStrategy.class);

    public static final String NAME = "TitleStrategy";

    private static final Comparator<MediaEntry> BY_TITLE = Comparator
            .comparing(MediaEntry::getTitle)
            .thenComparingInt(MediaEntry::getAnilistId)
            .thenComparingInt(MediaEntry::getMalId);

    private final TitleMatcher titleMatcher;
    private final MatchGuard guard;

    public TitleStrategy(TitleMatcher titleMatcher, MatchGuard guard) {
        this.titleMatcher = Objects.requireNonNull(titleMatcher, "titleMatcher is required");
        this.guard = Objects.requireNonNull(guard, "guard is required");
    }

    @Override
    public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                           ResolutionContext context) {
        String title = source.getTitle();
        if (title.isEmpty() || knownTargets.isEmpty()) {
            return Optional.empty();
        }

        List<MediaEntry> candidates = new ArrayList<>(knownTargets.values());
        candidates.sort(BY_TITLE);

        for (MediaEntry candidate : candidates) {
            if (candidate.getTitle().equals(title)) {
                return Optional.of(candidate);
            }
        }

        for (MediaEntry candidate : candidates) {
            if (!titleMatcher.sameTitle(source, candidate)
                    || !titleMatcher.sameType(source, candidate, context.getDirection())) {
                continue;
            }
            if (guard.shouldReject(source, candidate, context)) {
                continue;
            }
            log.debug("{}: '{}' matched '{}'", NAME, title, candidate.getTitle());
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return NAME;
    }
}
