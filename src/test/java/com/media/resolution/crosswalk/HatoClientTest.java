package com.media.resolution.crosswalk;

import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.ResolutionCancelledException;
import com.media.resolution.metrics.MetricsService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HatoClientTest {

    private static final String FRIEREN = "/api/mappings/anilist/anime/154587";

    @TempDir
    Path cacheDir;

    @Mock
    private MetricsService metrics;

    private MockWebServer server;
    private CrosswalkCache cache;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        cache = new CrosswalkCache(cacheDir);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private HatoClient client() {
        HttpSettings settings = HttpSettings.of(server.url("/").toString()).withBackoff(Duration.ofMillis(1));
        return new HatoClient(settings, cache, metrics);
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse().setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Should fetch a pair and cache it")
        void testFetchAndCache() throws Exception {
            server.enqueue(json(200,
                    "{\"data\":{\"anilist_id\":154587,\"mal_id\":52991,\"type_str\":\"anime\",\"extra\":1}}"));
            HatoClient hato = client();

            assertEquals(OptionalInt.of(52991), hato.lookup(CatalogService.ANILIST, MediaKind.ANIME, 154587));
            assertEquals(OptionalInt.of(52991), hato.lookup(CatalogService.ANILIST, MediaKind.ANIME, 154587));

            assertEquals(1, server.getRequestCount());
            RecordedRequest request = server.takeRequest();
            assertEquals(FRIEREN, request.getPath());
            assertEquals("Mozilla/5.0", request.getHeader("User-Agent"));
            verify(metrics).recordCrosswalkCacheMiss("hato");
            verify(metrics).recordCrosswalkCacheHit("hato");
            assertTrue(cache.isDirty());
        }

        @Test
        @DisplayName("Should answer from the cache without a request")
        void testCacheHit() {
            cache.put(CatalogService.MYANIMELIST, MediaKind.MANGA, 2, CrosswalkRecord.of(30002, 2));

            assertEquals(OptionalInt.of(30002), client().lookup(CatalogService.MYANIMELIST, MediaKind.MANGA, 2));
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("Should remember a miss")
        void testNegativeCache() {
            server.enqueue(new MockResponse().setResponseCode(404));
            HatoClient hato = client();

            assertTrue(hato.lookup(CatalogService.ANILIST, MediaKind.ANIME, 1).isEmpty());
            assertTrue(hato.lookup(CatalogService.ANILIST, MediaKind.ANIME, 1).isEmpty());

            assertEquals(1, server.getRequestCount());
            assertTrue(cache.get(CatalogService.ANILIST, MediaKind.ANIME, 1).orElseThrow().isEmpty());
        }

        @Test
        @DisplayName("Should not look up non-positive ids")
        void testInvalidId() {
            assertTrue(client().lookup(CatalogService.ANILIST, MediaKind.ANIME, 0).isEmpty());
            verifyNoInteractions(metrics);
        }
    }

    @Nested
    @DisplayName("Transport")
    class Transport {

        @Test
        @DisplayName("Should retry server errors")
        void testRetry() {
            server.enqueue(json(503, "{}"));
            server.enqueue(json(500, "{}"));
            server.enqueue(json(200, "{\"data\":{\"anilist_id\":154587,\"mal_id\":52991}}"));

            assertEquals(OptionalInt.of(52991), client().lookup(CatalogService.ANILIST, MediaKind.ANIME, 154587));
            assertEquals(3, server.getRequestCount());
        }

        @Test
        @DisplayName("Should not retry client errors")
        void testClientError() {
            server.enqueue(json(400, "{}"));

            assertThrows(CrosswalkException.class,
                    () -> client().lookup(CatalogService.ANILIST, MediaKind.ANIME, 154587));
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("Should fail on an unreadable body")
        void testBadBody() {
            server.enqueue(json(200, "not json"));

            assertThrows(CrosswalkException.class,
                    () -> client().lookup(CatalogService.ANILIST, MediaKind.ANIME, 154587));
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("Should stop retrying once the run is cancelled")
        void testCancelledBetweenRetries() {
            server.enqueue(json(503, "{}"));
            server.enqueue(json(200, "{\"data\":{\"anilist_id\":154587,\"mal_id\":52991}}"));

            assertThrows(ResolutionCancelledException.class,
                    () -> client().lookup(CatalogService.ANILIST, MediaKind.ANIME, 154587, () -> true));
            assertEquals(1, server.getRequestCount());
            assertFalse(cache.isDirty());
        }

        @Test
        @DisplayName("Should fail when the service is unreachable")
        void testUnreachable() {
            HttpSettings settings = HttpSettings.of("http://127.0.0.1:1").withMaxAttempts(1);
            HatoClient hato = new HatoClient(settings, cache, metrics);

            assertThrows(CrosswalkException.class, () -> hato.lookup(CatalogService.ANILIST, MediaKind.ANIME, 5));
            assertFalse(cache.isDirty());
        }
    }

    @Test
    @DisplayName("Retryable statuses")
    void testRetryable() {
        assertTrue(HttpCrosswalkClient.isRetryable(429));
        assertTrue(HttpCrosswalkClient.isRetryable(408));
        assertTrue(HttpCrosswalkClient.isRetryable(502));
        assertFalse(HttpCrosswalkClient.isRetryable(404));
        assertFalse(HttpCrosswalkClient.isRetryable(400));
    }
}
