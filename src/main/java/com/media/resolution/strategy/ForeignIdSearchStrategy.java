package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.service.DestinationService;
import com.media.resolution.service.MediaServiceException;
import com.media.resolution.similarity.TitleMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks the destination service for entries that reference the source's own id.
 *
 * <p>The first result agreeing on title and type wins; a single result is trusted as is.
 * If the user already tracks the result, their entry is returned instead of the fetched one.</p>
 */
public class ForeignIdSearchStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(ForeignIdSearchStrategy.class);

    public static final String NAME = "ForeignIdSearchStrategy";

    private final DestinationService service;
    private final TitleMatcher titleMatcher;

    public ForeignIdSearchStrategy(DestinationService service, TitleMatcher titleMatcher) {
        this.service = Objects.requireNonNull(service, "service is required");
        this.titleMatcher = Objects.requireNonNull(titleMatcher, "titleMatcher is required");
    }

    @Override
    public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                           ResolutionContext context) {
        context.throwIfCancelled(NAME + " lookup");

        int sourceId = context.getDirection().sourceId(source);
        if (sourceId <= 0) {
            return Optional.empty();
        }

        List<MediaEntry> results;
        try {
            results = service.getByForeignId(sourceId);
        } catch (MediaServiceException e) {
            throw new MediaServiceException("error getting target by foreign id " + sourceId, e);
        }
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }

        MediaEntry chosen = null;
        for (MediaEntry result : results) {
            if (titleMatcher.sameTitle(source, result)
                    && titleMatcher.sameType(source, result, context.getDirection())) {
                chosen = result;
                break;
            }
        }
        if (chosen == null && results.size() == 1) {
            chosen = results.get(0);
        }
        if (chosen == null) {
            log.debug("{}: {} results for id {} but none fits '{}'", NAME, results.size(), sourceId, source.getTitle());
            return Optional.empty();
        }

        MediaEntry existing = knownTargets.get(context.getDirection().targetId(chosen));
        if (existing != null) {
            log.debug("{}: '{}' resolved to the user's existing entry '{}'", NAME, source.getTitle(),
                    existing.getTitle());
            return Optional.of(existing);
        }
        return Optional.of(chosen);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
