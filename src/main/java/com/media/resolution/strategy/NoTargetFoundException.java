package com.media.resolution.strategy;

/**
 * Runtime exception thrown by the chain when every strategy declined the source.
 */
public class NoTargetFoundException extends RuntimeException {

    public NoTargetFoundException(String message) {
        super(message);
    }

    public NoTargetFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
