package com.media.resolution.api;

import com.media.resolution.config.MappingsConfig;
import com.media.resolution.core.ResolutionCancelledException;
import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.Conflict;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.ResolvedMapping;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.logging.LogContext;
import com.media.resolution.metrics.MetricsService;
import com.media.resolution.report.ReportSink;
import com.media.resolution.report.SyncStatistics;
import com.media.resolution.report.UnmappedEntry;
import com.media.resolution.report.UpdateResult;
import com.media.resolution.strategy.NoTargetFoundException;
import com.media.resolution.strategy.StrategyChain;
import com.media.resolution.strategy.StrategyFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves every source of one catalog against the user's list in the other, then deduplicates.
 *
 * <p>A pass runs once: {@code IDLE -> RESOLVING -> DEDUPLICATING -> DONE}. Sources are visited
 * in input order. Per-source failures are recorded and never end the pass; cancellation stops
 * resolution early, and the mappings found so far are still deduplicated and returned.</p>
 */
public class ResolutionPass {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPass.class);

    static final String FORCE_SYNC = "ForceSync";
    static final String REASON_IGNORED = "in ignore list";
    static final String REASON_UNMAPPED = "unmapped";

    private final StrategyChain chain;
    private final Deduplicator deduplicator;
    private final MappingsConfig mappings;
    private final MetricsService metrics;

    private PassState state = PassState.IDLE;

    public ResolutionPass(StrategyChain chain, Deduplicator deduplicator, MappingsConfig mappings,
                          MetricsService metrics) {
        this.chain = Objects.requireNonNull(chain, "chain is required");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator is required");
        this.mappings = Objects.requireNonNull(mappings, "mappings is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public synchronized PassState getState() {
        return state;
    }

    /**
     * Runs the pass.
     *
     * @param sources      entries of the source catalog
     * @param knownTargets entries on the user's destination list, by destination id
     * @param context      options, report sink and cancellation signal
     * @throws IllegalStateException if this pass has already run
     */
    public PassResult run(List<MediaEntry> sources, Map<TargetId, MediaEntry> knownTargets,
                          ResolutionContext context) {
        transition(PassState.IDLE, PassState.RESOLVING);
        Instant started = Instant.now();
        SyncStatistics statistics = new SyncStatistics();
        List<ResolvedMapping> resolved = new ArrayList<>();
        List<UnmappedEntry> unmapped = new ArrayList<>();
        boolean truncated = false;

        try (LogContext ignored = LogContext.forPass(context)) {
            log.info("pass.started options={} sources={} known={} strategies={}",
                    context.getOptions().describe(), sources.size(), knownTargets.size(), chain.getStrategyNames());

            for (MediaEntry source : sources) {
                if (!source.hasStatus()) {
                    continue;
                }
                if (context.isCancelled()) {
                    log.info("pass.cancelled resolved={} remaining sources skipped", resolved.size());
                    truncated = true;
                    break;
                }
                statistics.incrementTotal();
                if (mappings.isIgnored(source, context.getDirection())) {
                    statistics.recordSkip(UpdateResult.skipped(source.getTitle(), statusLabel(source), REASON_IGNORED));
                    continue;
                }
                try (LogContext sourceCtx = LogContext.forSource(source)) {
                    ResolvedMapping mapping = resolve(source, knownTargets, context);
                    if (mapping == null) {
                        recordNotFound(source, "no foreign id to force sync to", context, statistics, unmapped);
                        continue;
                    }
                    resolved.add(mapping);
                    metrics.incrementResolved(mapping.strategyName());
                    log.debug("source.resolved target={} strategy={}", mapping.targetId(), mapping.strategyName());
                } catch (NoTargetFoundException e) {
                    recordNotFound(source, "no match found", context, statistics, unmapped);
                } catch (StrategyFailureException e) {
                    metrics.incrementStrategyFailure(e.getStrategyName());
                    log.warn("source.failed title='{}' error={}", source.getTitle(), e.getMessage());
                    recordNotFound(source, e.getMessage(), context, statistics, unmapped);
                } catch (ResolutionCancelledException e) {
                    log.info("pass.cancelled resolved={} reason={}", resolved.size(), e.getMessage());
                    truncated = true;
                    break;
                }
            }

            transition(PassState.RESOLVING, PassState.DEDUPLICATING);
            Deduplicator.Result deduplicated = deduplicator.deduplicate(resolved);
            for (Conflict conflict : deduplicated.conflicts()) {
                recordConflict(conflict, context, statistics, unmapped);
            }

            transition(PassState.DEDUPLICATING, PassState.DONE);
            Duration elapsed = Duration.between(started, Instant.now());
            metrics.recordPassDuration(context.getOptions().getMediaKind(), context.getDirection(), elapsed);
            metrics.recordMappingCount(deduplicated.kept().size());
            log.info("pass.completed total={} resolved={} kept={} conflicts={} unmapped={} truncated={} elapsedMs={}",
                    statistics.getTotalCount(), resolved.size(), deduplicated.kept().size(),
                    deduplicated.conflicts().size(), unmapped.size(), truncated, elapsed.toMillis());

            return new PassResult(deduplicated.kept(), deduplicated.conflicts(), unmapped, statistics, truncated);
        }
    }

    private ResolvedMapping resolve(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                    ResolutionContext context) {
        if (!context.getOptions().isForceSync()) {
            return chain.resolve(source, knownTargets, context);
        }
        SyncDirection direction = context.getDirection();
        TargetId declared = direction.targetId(source);
        if (!declared.isPresent()) {
            return null;
        }
        // an id the user does not track yet is still applied; the source stands in for the target
        MediaEntry target = knownTargets.getOrDefault(declared, source);
        return new ResolvedMapping(source, target, declared, FORCE_SYNC, 0);
    }

    private void recordNotFound(MediaEntry source, String reason, ResolutionContext context,
                                SyncStatistics statistics, List<UnmappedEntry> unmapped) {
        log.debug("source.unmapped title='{}' reason={}", source.getTitle(), reason);
        UnmappedEntry entry = UnmappedEntry.of(source, context.getDirection(), reason);
        unmapped.add(entry);
        context.getReportSink().onUnmapped(entry);
        statistics.recordSkip(UpdateResult.skipped(source.getTitle(), statusLabel(source), REASON_UNMAPPED));
        metrics.incrementNotFound(source.getKind());
    }

    private void recordConflict(Conflict conflict, ResolutionContext context, SyncStatistics statistics,
                                List<UnmappedEntry> unmapped) {
        MediaEntry loser = conflict.loser().source();
        log.warn("dedup.conflict target={} kept='{}' via {} dropped='{}' via {}",
                conflict.targetId(), conflict.winnerTitle(), conflict.winnerStrategy(),
                conflict.loserTitle(), conflict.loserStrategy());
        ReportSink sink = context.getReportSink();
        sink.onConflict(conflict);
        UnmappedEntry entry = UnmappedEntry.of(loser, context.getDirection(), conflict.reason());
        unmapped.add(entry);
        sink.onUnmapped(entry);
        statistics.recordSkip(UpdateResult.skipped(loser.getTitle(), statusLabel(loser), conflict.reason()));
        metrics.incrementConflict(loser.getKind());
    }

    private synchronized void transition(PassState from, PassState to) {
        if (state != from) {
            throw new IllegalStateException("pass is " + state + ", expected " + from);
        }
        log.trace("pass.state {} -> {}", from, to);
        state = to;
    }

    static String statusLabel(MediaEntry entry) {
        return entry.hasStatus() ? entry.getStatus().labelFor(entry.getKind()) : "";
    }
}
