package com.media.resolution.report;

import com.media.resolution.core.model.Conflict;

final class DiscardingReportSink implements ReportSink {

    static final DiscardingReportSink INSTANCE = new DiscardingReportSink();

    private DiscardingReportSink() {
    }

    @Override
    public void onWarning(MatchWarning warning) {
    }

    @Override
    public void onConflict(Conflict conflict) {
    }

    @Override
    public void onUnmapped(UnmappedEntry entry) {
    }
}
