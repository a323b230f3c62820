package com.media.resolution.core;

import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.report.ReportSink;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-pass run context: options, the report sink and the cancellation signal.
 * The signal may be shared by several contexts so one call cancels every pass of a run.
 */
public class ResolutionContext {

    private final String passId;
    private final ResolutionOptions options;
    private final ReportSink reportSink;
    private final AtomicBoolean cancelled;

    private ResolutionContext(String passId, ResolutionOptions options, ReportSink reportSink,
                              AtomicBoolean cancelled) {
        this.passId = passId;
        this.options = Objects.requireNonNull(options, "options is required");
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink is required");
        this.cancelled = Objects.requireNonNull(cancelled, "cancelled is required");
    }

    public static ResolutionContext of(ResolutionOptions options) {
        return of(options, ReportSink.discarding());
    }

    public static ResolutionContext of(ResolutionOptions options, ReportSink reportSink) {
        return new ResolutionContext(newPassId(), options, reportSink, new AtomicBoolean());
    }

    /**
     * Creates a context for another pass of the same run, sharing the cancellation signal and sink.
     */
    public ResolutionContext forPass(ResolutionOptions passOptions) {
        return new ResolutionContext(newPassId(), passOptions, reportSink, cancelled);
    }

    public String getPassId() {
        return passId;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public SyncDirection getDirection() {
        return options.getDirection();
    }

    public ReportSink getReportSink() {
        return reportSink;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * Cancellation checkpoint.
     *
     * @param checkpoint what was about to happen, for the exception message
     * @throws ResolutionCancelledException if the run has been cancelled
     */
    public void throwIfCancelled(String checkpoint) {
        if (isCancelled()) {
            throw new ResolutionCancelledException("cancelled before " + checkpoint);
        }
    }

    private static String newPassId() {
        return UUID.randomUUID().toString();
    }
}
