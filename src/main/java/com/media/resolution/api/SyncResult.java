package com.media.resolution.api;

import com.media.resolution.report.SyncStatistics;

/**
 * Resolution plus apply outcome of one pass.
 *
 * @param pass       the resolution result that was applied
 * @param statistics counters covering both phases
 * @param truncated  true if either phase stopped early on cancellation
 */
public record SyncResult(PassResult pass, SyncStatistics statistics, boolean truncated) {
}
