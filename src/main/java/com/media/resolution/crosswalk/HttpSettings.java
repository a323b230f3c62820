package com.media.resolution.crosswalk;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport settings for live crosswalk services.
 *
 * @param baseUrl     service root, without trailing slash
 * @param timeout     connect and request timeout
 * @param maxAttempts attempts per request, including the first
 * @param backoff     delay before the second attempt; doubles per further attempt
 */
public record HttpSettings(String baseUrl, Duration timeout, int maxAttempts, Duration backoff) {

    public HttpSettings {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        Objects.requireNonNull(timeout, "timeout is required");
        Objects.requireNonNull(backoff, "backoff is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static HttpSettings of(String baseUrl) {
        return new HttpSettings(baseUrl, Duration.ofSeconds(10), 3, Duration.ofMillis(500));
    }

    public HttpSettings withMaxAttempts(int attempts) {
        return new HttpSettings(baseUrl, timeout, attempts, backoff);
    }

    public HttpSettings withBackoff(Duration delay) {
        return new HttpSettings(baseUrl, timeout, maxAttempts, delay);
    }
}
