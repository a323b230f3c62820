package com.media.resolution.crosswalk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.media.resolution.core.ResolutionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Base for live crosswalk services: JSON GET with retries on transport errors,
 * 408, 429 and 5xx responses. A 404 means the service has no pair for the id.
 */
abstract class HttpCrosswalkClient implements IdCrosswalk {
    private static final Logger log = LoggerFactory.getLogger(HttpCrosswalkClient.class);

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    protected final HttpSettings settings;
    protected final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    protected HttpCrosswalkClient(HttpSettings settings) {
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.timeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Adds service-specific headers.
     */
    protected HttpRequest.Builder decorate(HttpRequest.Builder request) {
        return request;
    }

    /**
     * Fetches {@code path} relative to the base URL and binds the body to {@code type}.
     *
     * @param cancelled polled before each retry and after each backoff
     * @return the body, or empty on 404
     * @throws CrosswalkException on any other failure once retries are exhausted
     * @throws ResolutionCancelledException if {@code cancelled} turns true before a retry
     */
    protected <T> Optional<T> getJson(String path, Class<T> type, BooleanSupplier cancelled) {
        URI uri = URI.create(settings.baseUrl() + path);
        HttpRequest request = decorate(HttpRequest.newBuilder()
                .uri(uri)
                .timeout(settings.timeout())
                .header("Accept", "application/json")
                .GET())
                .build();

        CrosswalkException lastFailure = null;
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            if (attempt > 1) {
                throwIfCancelled(cancelled, uri);
                Duration wait = backoff(attempt);
                log.warn("crosswalk.http.retry name={} attempt={}/{} uri={} wait={}",
                        getName(), attempt, settings.maxAttempts(), uri, wait);
                sleep(wait);
                throwIfCancelled(cancelled, uri);
            }
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                log.debug("crosswalk.http name={} uri={} status={}", getName(), uri, status);
                if (status == 404) {
                    return Optional.empty();
                }
                if (status == 200) {
                    return Optional.ofNullable(objectMapper.readValue(response.body(), type));
                }
                lastFailure = new CrosswalkException(getName() + " returned status " + status + " for " + uri);
                if (!isRetryable(status)) {
                    throw lastFailure;
                }
            } catch (JsonProcessingException e) {
                throw new CrosswalkException(getName() + " returned an unreadable body for " + uri, e);
            } catch (IOException e) {
                lastFailure = new CrosswalkException(getName() + " request failed: " + uri, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CrosswalkException(getName() + " request interrupted: " + uri, e);
            }
        }
        throw lastFailure;
    }

    private void throwIfCancelled(BooleanSupplier cancelled, URI uri) {
        if (cancelled.getAsBoolean()) {
            log.debug("crosswalk.http.cancelled name={} uri={}", getName(), uri);
            throw new ResolutionCancelledException("cancelled before retrying " + getName() + " lookup");
        }
    }

    static boolean isRetryable(int status) {
        return status == 408 || status == 429 || (status >= 500 && status < 600);
    }

    private Duration backoff(int attempt) {
        Duration delay = settings.backoff().multipliedBy(1L << Math.min(attempt - 2, 16));
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    private static void sleep(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrosswalkException("interrupted while backing off", e);
        }
    }
}
