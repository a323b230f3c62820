package com.media.resolution.report;

import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.SyncDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.media.resolution.MediaFixtures.anime;
import static com.media.resolution.MediaFixtures.manga;
import static org.junit.jupiter.api.Assertions.*;

class ReportTest {

    @Nested
    @DisplayName("UnmappedState")
    class State {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Should save with snake_case fields and load back")
        void testSaveAndLoad() throws Exception {
            Path file = dir.resolve("state").resolve("unmapped.json");
            UnmappedState state = UnmappedState.of(List.of(
                    UnmappedEntry.of(anime(1, 0, "Frieren", 28), SyncDirection.FORWARD, "no match found"),
                    UnmappedEntry.of(manga(0, 2, "Berserk", 0, 0), SyncDirection.REVERSE, "unmapped")));

            state.save(file);

            String json = Files.readString(file);
            assertTrue(json.contains("\"anilist_id\""));
            assertTrue(json.contains("\"updated_at\""));

            UnmappedState loaded = UnmappedState.load(file);
            assertEquals(state.entries(), loaded.entries());
            assertEquals(state.updatedAt(), loaded.updatedAt());
            assertEquals("manga", loaded.entries().get(1).mediaType());
            assertEquals("reverse", loaded.entries().get(1).direction());
        }

        @Test
        @DisplayName("A missing file yields an empty state")
        void testMissing() {
            UnmappedState state = UnmappedState.load(dir.resolve("none.json"));
            assertTrue(state.entries().isEmpty());
            assertNull(state.updatedAt());
        }
    }

    @Nested
    @DisplayName("SyncStatistics")
    class Statistics {

        @Test
        @DisplayName("Should count outcomes and statuses")
        void testCounts() {
            SyncStatistics statistics = new SyncStatistics();
            statistics.incrementTotal();
            statistics.incrementTotal();
            statistics.incrementTotal();
            statistics.recordUpdate(UpdateResult.applied("A", "watching", "ep 1 -> 2"));
            statistics.recordSkip(UpdateResult.skipped("B", "watching", "no changes"));
            statistics.recordError(UpdateResult.failed("C", "completed", "HTTP 500"));
            statistics.finish();

            assertEquals(3, statistics.getTotalCount());
            assertEquals(1, statistics.getUpdatedCount());
            assertEquals(1, statistics.getSkippedCount());
            assertEquals(1, statistics.getErrorCount());
            assertEquals(2, statistics.getStatusCounts().get("watching"));
            assertNull(statistics.getStatusCounts().get("completed"));
            assertFalse(statistics.getDuration().isNegative());
            assertEquals("SyncStatistics{total=3, updated=1, skipped=1, dryRun=0, errors=1}", statistics.toString());
        }
    }

    @Nested
    @DisplayName("SyncReport")
    class Report {

        @Test
        @DisplayName("Should collect outcomes and snapshot unmapped entries")
        void testCollect() {
            SyncReport report = new SyncReport();
            assertFalse(report.hasIssues());

            MediaEntry source = anime(1, 0, "Frieren", 28);
            report.onWarning(new MatchWarning("Frieren", "episode count mismatch (special vs series)", "(1 vs 28)",
                    source.getKind()));
            report.onUnmapped(UnmappedEntry.of(source, SyncDirection.FORWARD, "no match found"));

            assertTrue(report.hasIssues());
            assertEquals(1, report.toUnmappedState().entries().size());
        }

        @Test
        @DisplayName("The discarding sink accepts everything")
        void testDiscarding() {
            assertDoesNotThrow(() -> ReportSink.discarding()
                    .onUnmapped(UnmappedEntry.of(anime(1, 0, "A", 1), SyncDirection.FORWARD, "x")));
        }
    }
}
