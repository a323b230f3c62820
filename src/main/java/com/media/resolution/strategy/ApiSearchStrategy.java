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
 * Last resort: fetch by the source's foreign id, or search the destination catalog by title.
 * Results the user already tracks are returned as the user's entry.
 */
public class ApiSearchStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(ApiSearchStrategy.class);

    public static final String NAME = "ApiSearchStrategy";

    private final DestinationService service;
    private final TitleMatcher titleMatcher;
    private final MatchGuard guard;

    public ApiSearchStrategy(DestinationService service, TitleMatcher titleMatcher, MatchGuard guard) {
        this.service = Objects.requireNonNull(service, "service is required");
        this.titleMatcher = Objects.requireNonNull(titleMatcher, "titleMatcher is required");
        this.guard = Objects.requireNonNull(guard, "guard is required");
    }

    @Override
    public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                           ResolutionContext context) {
        context.throwIfCancelled(NAME + " request");

        TargetId foreignId = context.getDirection().targetId(source);
        if (foreignId.isPresent()) {
            return findById(foreignId, knownTargets);
        }
        return findByTitle(source, knownTargets, context);
    }

    private Optional<MediaEntry> findById(TargetId id, Map<TargetId, MediaEntry> knownTargets) {
        Optional<MediaEntry> fetched;
        try {
            fetched = service.getById(id);
        } catch (MediaServiceException e) {
            throw new MediaServiceException("error getting target by id " + id, e);
        }
        if (fetched.isEmpty()) {
            return Optional.empty();
        }
        MediaEntry existing = knownTargets.get(id);
        return Optional.of(existing != null ? existing : fetched.get());
    }

    private Optional<MediaEntry> findByTitle(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                             ResolutionContext context) {
        String title = source.getTitle();
        if (title.isEmpty()) {
            return Optional.empty();
        }

        List<MediaEntry> results;
        try {
            results = service.searchByTitle(title);
        } catch (MediaServiceException e) {
            throw new MediaServiceException("error searching targets by title '" + title + "'", e);
        }
        if (results == null) {
            return Optional.empty();
        }

        for (MediaEntry result : results) {
            MediaEntry existing = knownTargets.get(context.getDirection().targetId(result));
            if (existing != null) {
                if (guard.shouldReject(source, existing, context) || !titleMatcher.sameTitle(source, existing)) {
                    continue;
                }
                return Optional.of(existing);
            }
            if (titleMatcher.sameType(source, result, context.getDirection())) {
                return Optional.of(result);
            }
            log.debug("{}: skipping '{}' for '{}': type mismatch ({} vs {})", NAME, result.getTitle(), title,
                    result.getKind(), source.getKind());
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return NAME;
    }
}
