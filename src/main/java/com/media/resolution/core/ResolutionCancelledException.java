package com.media.resolution.core;

/**
 * Runtime exception thrown at a cancellation checkpoint once the run has been cancelled.
 * Aborts the rest of the current pass; results gathered so far are kept.
 */
public class ResolutionCancelledException extends RuntimeException {

    public ResolutionCancelledException(String message) {
        super(message);
    }

    public ResolutionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
