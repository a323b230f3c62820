package com.media.resolution.config;

/**
 * Runtime exception thrown when the mappings file exists but cannot be read or parsed.
 */
public class MappingsConfigException extends RuntimeException {

    public MappingsConfigException(String message) {
        super(message);
    }

    public MappingsConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
