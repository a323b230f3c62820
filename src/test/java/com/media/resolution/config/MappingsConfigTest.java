package com.media.resolution.config;

import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.SyncDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;

import static com.media.resolution.MediaFixtures.anime;
import static org.junit.jupiter.api.Assertions.*;

class MappingsConfigTest {

    private MappingsConfig config;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/mappings.yaml")) {
            config = MappingsConfig.parse(in);
        }
    }

    private static MappingsConfig parse(String yaml) {
        return MappingsConfig.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Manual mappings")
    class Manual {

        @Test
        @DisplayName("Should read every pair and index the complete ones")
        void testPairs() {
            assertEquals(3, config.getManualMappings().size());
            assertEquals("One Piece", config.getManualMappings().get(0).comment());
            assertEquals(OptionalInt.of(200), config.manualMapping(CatalogService.MYANIMELIST, 100));
            assertEquals(OptionalInt.of(100), config.manualMapping(CatalogService.ANILIST, 200));
            assertTrue(config.manualMapping(CatalogService.ANILIST, 5).isEmpty());
        }

        @Test
        @DisplayName("An empty document has no mappings")
        void testEmpty() {
            MappingsConfig empty = parse("");
            assertFalse(empty.hasManualMappings());
            assertTrue(empty.getIgnore().titles().isEmpty());
        }

        @Test
        @DisplayName("Malformed YAML is reported")
        void testMalformed() {
            assertThrows(MappingsConfigException.class, () -> parse("manual_mappings: [ {anilist_id: 1"));
        }
    }

    @Nested
    @DisplayName("Ignore rules")
    class Ignore {

        @Test
        @DisplayName("Should match titles ignoring case")
        void testTitle() {
            assertTrue(config.isIgnored(anime(50, 50, "SOME RECAP SPECIAL", 1), SyncDirection.FORWARD));
        }

        @Test
        @DisplayName("Should check ids of the source catalog only")
        void testIds() {
            assertTrue(config.isIgnored(anime(1, 7, "A", 1), SyncDirection.FORWARD));
            assertFalse(config.isIgnored(anime(1, 7, "A", 1), SyncDirection.REVERSE));
            assertTrue(config.isIgnored(anime(9, 2, "B", 1), SyncDirection.REVERSE));
            assertFalse(config.isIgnored(anime(9, 2, "B", 1), SyncDirection.FORWARD));
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("A missing file yields an empty configuration")
        void testMissing(@TempDir Path dir) {
            MappingsConfig loaded = MappingsConfig.load(dir.resolve("mappings.yaml"));
            assertFalse(loaded.hasManualMappings());
        }

        @Test
        @DisplayName("Should load from a file")
        void testLoad(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("mappings.yaml");
            Files.writeString(file, "manual_mappings:\n  - anilist_id: 3\n    mal_id: 4\n");

            assertEquals(OptionalInt.of(4), MappingsConfig.load(file).manualMapping(CatalogService.MYANIMELIST, 3));
        }
    }
}
