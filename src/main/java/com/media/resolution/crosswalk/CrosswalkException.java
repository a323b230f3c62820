package com.media.resolution.crosswalk;

/**
 * Runtime exception thrown when a crosswalk lookup fails (transport, status or payload).
 */
public class CrosswalkException extends RuntimeException {

    public CrosswalkException(String message) {
        super(message);
    }

    public CrosswalkException(String message, Throwable cause) {
        super(message, cause);
    }
}
