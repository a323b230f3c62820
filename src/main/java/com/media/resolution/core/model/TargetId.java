package com.media.resolution.core.model;

/**
 * Numeric identifier scoped to the destination catalog.
 * Zero or negative values mean "unknown".
 */
public record TargetId(int value) {

    private static final TargetId NONE = new TargetId(0);

    public static TargetId of(int value) {
        return value > 0 ? new TargetId(value) : NONE;
    }

    public static TargetId none() {
        return NONE;
    }

    public boolean isPresent() {
        return value > 0;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
