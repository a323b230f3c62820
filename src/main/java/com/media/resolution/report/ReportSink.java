package com.media.resolution.report;

import com.media.resolution.core.model.Conflict;

/**
 * Receives structured outcomes of a resolution pass.
 * Implementations decide how, or whether, to render them for an operator.
 */
public interface ReportSink {

    void onWarning(MatchWarning warning);

    void onConflict(Conflict conflict);

    void onUnmapped(UnmappedEntry entry);

    /**
     * A sink that discards everything.
     */
    static ReportSink discarding() {
        return DiscardingReportSink.INSTANCE;
    }
}
