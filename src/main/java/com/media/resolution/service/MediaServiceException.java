package com.media.resolution.service;

/**
 * Runtime exception thrown by {@link DestinationService} implementations.
 */
public class MediaServiceException extends RuntimeException {

    public MediaServiceException(String message) {
        super(message);
    }

    public MediaServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
