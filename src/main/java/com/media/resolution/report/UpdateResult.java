package com.media.resolution.report;

/**
 * Outcome of applying, or declining to apply, one mapping.
 *
 * @param title      source title
 * @param status     list status label of the source
 * @param detail     what changed, e.g. "ep 10 -> 15"
 * @param skipReason why nothing was applied; null when applied
 * @param error      failure message; null on success
 */
public record UpdateResult(String title, String status, String detail, String skipReason, String error) {

    public static UpdateResult applied(String title, String status, String detail) {
        return new UpdateResult(title, status, detail, null, null);
    }

    public static UpdateResult skipped(String title, String status, String reason) {
        return new UpdateResult(title, status, null, reason, null);
    }

    public static UpdateResult failed(String title, String status, String error) {
        return new UpdateResult(title, status, null, null, error);
    }
}
