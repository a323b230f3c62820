package com.media.resolution.report;

import com.media.resolution.core.model.MediaKind;

/**
 * A candidate match the title heuristics refused.
 *
 * @param title  source title
 * @param reason why the candidate was refused
 * @param detail unit counts, e.g. "(1 vs 13)"
 * @param kind   media kind of the source
 */
public record MatchWarning(String title, String reason, String detail, MediaKind kind) {
}
