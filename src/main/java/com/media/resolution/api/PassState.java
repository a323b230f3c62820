package com.media.resolution.api;

/**
 * Lifecycle of a {@link ResolutionPass}. Transitions only move forward.
 */
public enum PassState {
    IDLE,
    RESOLVING,
    DEDUPLICATING,
    DONE
}
