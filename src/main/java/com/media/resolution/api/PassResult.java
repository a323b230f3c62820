package com.media.resolution.api;

import com.media.resolution.core.model.Conflict;
import com.media.resolution.core.model.ResolvedMapping;
import com.media.resolution.report.SyncStatistics;
import com.media.resolution.report.UnmappedEntry;

import java.util.List;

/**
 * Outcome of a resolution pass.
 *
 * @param mappings   kept mappings, at most one per target
 * @param conflicts  claims that lost deduplication
 * @param unmapped   sources without an applicable mapping, conflicts included
 * @param statistics counters for the pass, shared with the apply phase
 * @param truncated  true if the pass was cancelled before visiting every source
 */
public record PassResult(
        List<ResolvedMapping> mappings,
        List<Conflict> conflicts,
        List<UnmappedEntry> unmapped,
        SyncStatistics statistics,
        boolean truncated
) {
    public PassResult {
        mappings = List.copyOf(mappings);
        conflicts = List.copyOf(conflicts);
        unmapped = List.copyOf(unmapped);
    }
}
