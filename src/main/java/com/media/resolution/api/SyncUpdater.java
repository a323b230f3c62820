package com.media.resolution.api;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.ResolutionOptions;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.ResolvedMapping;
import com.media.resolution.logging.LogContext;
import com.media.resolution.report.SyncStatistics;
import com.media.resolution.report.UpdateResult;
import com.media.resolution.service.DestinationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies the kept mappings of a pass to the destination catalog.
 */
public class SyncUpdater {
    private static final Logger log = LoggerFactory.getLogger(SyncUpdater.class);

    static final String REASON_NO_CHANGES = "no changes";

    private final DestinationService service;

    public SyncUpdater(DestinationService service) {
        this.service = Objects.requireNonNull(service, "service is required");
    }

    /**
     * Applies {@code pass} and returns its statistics, extended with the apply outcomes.
     * Stops before the next update once the run is cancelled.
     */
    public SyncResult apply(PassResult pass, ResolutionContext context) {
        ResolutionOptions options = context.getOptions();
        SyncStatistics statistics = pass.statistics();
        boolean truncated = pass.truncated();

        try (LogContext ignored = LogContext.forPass(context)) {
            List<ResolvedMapping> mappings = pass.mappings();
            for (int i = 0; i < mappings.size(); i++) {
                if (context.isCancelled()) {
                    log.info("apply.cancelled remaining={}", mappings.size() - i);
                    truncated = true;
                    break;
                }
                applyOne(mappings.get(i), options, statistics);
            }
            statistics.finish();
            log.info("apply.completed {}", statistics);
        }
        return new SyncResult(pass, statistics, truncated);
    }

    private void applyOne(ResolvedMapping mapping, ResolutionOptions options, SyncStatistics statistics) {
        MediaEntry source = mapping.source();
        MediaEntry target = mapping.target();
        String status = ResolutionPass.statusLabel(source);

        if (!options.isForceSync() && source.sameProgressAs(target)) {
            statistics.recordSkip(UpdateResult.skipped(source.getTitle(), status, REASON_NO_CHANGES));
            return;
        }

        String detail = describeChange(source, target, options.isForceSync());
        if (options.isDryRun()) {
            log.info("apply.dry_run title='{}' target={} change={}", source.getTitle(), mapping.targetId(), detail);
            statistics.recordDryRun(UpdateResult.applied(source.getTitle(), status, detail));
            return;
        }

        try {
            service.update(mapping.targetId(), source);
            log.info("apply.updated title='{}' target={} change={}", source.getTitle(), mapping.targetId(), detail);
            statistics.recordUpdate(UpdateResult.applied(source.getTitle(), status, detail));
        } catch (RuntimeException e) {
            log.warn("apply.failed title='{}' target={} error={}", source.getTitle(), mapping.targetId(),
                    e.getMessage());
            statistics.recordError(UpdateResult.failed(source.getTitle(), status, e.getMessage()));
        }
    }

    /**
     * Short human-readable diff, e.g. "status: watching -> completed, ep 10 -> 12".
     */
    static String describeChange(MediaEntry source, MediaEntry target, boolean forced) {
        if (forced && source == target) {
            return "forced";
        }
        List<String> parts = new ArrayList<>();
        MediaKind kind = source.getKind();
        if (source.getStatus() != target.getStatus()) {
            parts.add("status: " + ResolutionPass.statusLabel(target) + " -> " + ResolutionPass.statusLabel(source));
        }
        String unit = kind == MediaKind.MANGA ? "ch" : "ep";
        if (source.getProgress() != target.getProgress()) {
            parts.add(unit + " " + target.getProgress() + " -> " + source.getProgress());
        }
        if (kind == MediaKind.MANGA && source.getProgressVolumes() != target.getProgressVolumes()) {
            parts.add("vol " + target.getProgressVolumes() + " -> " + source.getProgressVolumes());
        }
        if (Double.compare(source.getScore(), target.getScore()) != 0) {
            parts.add("score " + formatScore(target.getScore()) + " -> " + formatScore(source.getScore()));
        }
        return parts.isEmpty() ? "forced" : String.join(", ", parts);
    }

    private static String formatScore(double score) {
        return score == Math.rint(score) ? Long.toString((long) score) : Double.toString(score);
    }
}
