package com.media.resolution.report;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and item lists for one pass. Not thread-safe; one instance per pass.
 */
public class SyncStatistics {

    private final Instant startTime;
    private Instant endTime;

    private int total;
    private final List<UpdateResult> updated = new ArrayList<>();
    private final List<UpdateResult> skipped = new ArrayList<>();
    private final List<UpdateResult> errors = new ArrayList<>();
    private final List<UpdateResult> dryRuns = new ArrayList<>();
    private final Map<String, Integer> statusCounts = new LinkedHashMap<>();

    public SyncStatistics() {
        this.startTime = Instant.now();
    }

    public void incrementTotal() {
        total++;
    }

    public void recordUpdate(UpdateResult result) {
        updated.add(result);
        countStatus(result);
    }

    public void recordSkip(UpdateResult result) {
        skipped.add(result);
        countStatus(result);
    }

    public void recordDryRun(UpdateResult result) {
        dryRuns.add(result);
        countStatus(result);
    }

    public void recordError(UpdateResult result) {
        errors.add(result);
    }

    public void finish() {
        if (endTime == null) {
            endTime = Instant.now();
        }
    }

    private void countStatus(UpdateResult result) {
        if (result.status() != null) {
            statusCounts.merge(result.status(), 1, Integer::sum);
        }
    }

    public int getTotalCount() {
        return total;
    }

    public int getUpdatedCount() {
        return updated.size();
    }

    public int getSkippedCount() {
        return skipped.size();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getDryRunCount() {
        return dryRuns.size();
    }

    public List<UpdateResult> getUpdatedItems() {
        return Collections.unmodifiableList(updated);
    }

    public List<UpdateResult> getSkippedItems() {
        return Collections.unmodifiableList(skipped);
    }

    public List<UpdateResult> getErrorItems() {
        return Collections.unmodifiableList(errors);
    }

    public List<UpdateResult> getDryRunItems() {
        return Collections.unmodifiableList(dryRuns);
    }

    public Map<String, Integer> getStatusCounts() {
        return Collections.unmodifiableMap(statusCounts);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime != null ? endTime : Instant.now());
    }

    @Override
    public String toString() {
        return "SyncStatistics{" +
                "total=" + total +
                ", updated=" + updated.size() +
                ", skipped=" + skipped.size() +
                ", dryRun=" + dryRuns.size() +
                ", errors=" + errors.size() +
                '}';
    }
}
