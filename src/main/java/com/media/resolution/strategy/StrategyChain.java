package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionCancelledException;
import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.ResolvedMapping;
import com.media.resolution.core.model.TargetId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs strategies in a fixed order and stops at the first match.
 * A strategy's position in the chain is its priority; lower wins during deduplication.
 */
public class StrategyChain {
    private static final Logger log = LoggerFactory.getLogger(StrategyChain.class);

    private final List<MatchStrategy> strategies;

    public StrategyChain(List<MatchStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<MatchStrategy> getStrategies() {
        return strategies;
    }

    public List<String> getStrategyNames() {
        return strategies.stream().map(MatchStrategy::getName).toList();
    }

    /**
     * Resolves one source.
     *
     * @return the mapping, carrying the matching strategy's name and index
     * @throws NoTargetFoundException       if no strategy matched
     * @throws StrategyFailureException     if a strategy's lookup failed
     * @throws ResolutionCancelledException if the run was cancelled
     */
    public ResolvedMapping resolve(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                   ResolutionContext context) {
        for (int index = 0; index < strategies.size(); index++) {
            MatchStrategy strategy = strategies.get(index);
            Optional<MediaEntry> target;
            try {
                target = strategy.findTarget(source, knownTargets, context);
            } catch (ResolutionCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StrategyFailureException(strategy.getName(), e);
            }
            if (target.isEmpty()) {
                continue;
            }
            TargetId targetId = context.getDirection().targetId(target.get());
            if (!targetId.isPresent()) {
                log.debug("{}: match '{}' for '{}' has no destination id, ignoring",
                        strategy.getName(), target.get().getTitle(), source.getTitle());
                continue;
            }
            return new ResolvedMapping(source, target.get(), targetId, strategy.getName(), index);
        }
        throw new NoTargetFoundException("no target found for source: " + source.getTitle());
    }
}
