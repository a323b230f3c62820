package com.media.resolution.report;

import com.media.resolution.core.model.Conflict;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link ReportSink}. Safe to share between passes running on different threads.
 */
public class SyncReport implements ReportSink {

    private final List<MatchWarning> warnings = new CopyOnWriteArrayList<>();
    private final List<Conflict> conflicts = new CopyOnWriteArrayList<>();
    private final List<UnmappedEntry> unmapped = new CopyOnWriteArrayList<>();

    @Override
    public void onWarning(MatchWarning warning) {
        warnings.add(warning);
    }

    @Override
    public void onConflict(Conflict conflict) {
        conflicts.add(conflict);
    }

    @Override
    public void onUnmapped(UnmappedEntry entry) {
        unmapped.add(entry);
    }

    public List<MatchWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    public List<Conflict> getConflicts() {
        return List.copyOf(conflicts);
    }

    public List<UnmappedEntry> getUnmapped() {
        return List.copyOf(unmapped);
    }

    public boolean hasIssues() {
        return !warnings.isEmpty() || !conflicts.isEmpty() || !unmapped.isEmpty();
    }

    /**
     * Snapshot of the unmapped entries, ready to persist.
     */
    public UnmappedState toUnmappedState() {
        return UnmappedState.of(getUnmapped());
    }
}
