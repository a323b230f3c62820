package com.media.resolution.strategy;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.report.MatchWarning;
import com.media.resolution.report.SyncReport;
import com.media.resolution.similarity.TitleMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static com.media.resolution.MediaFixtures.anime;
import static com.media.resolution.MediaFixtures.forward;
import static com.media.resolution.MediaFixtures.manga;
import static com.media.resolution.MediaFixtures.reverse;
import static org.junit.jupiter.api.Assertions.*;

class MatchGuardTest {

    private final MatchGuard guard = new MatchGuard(new TitleMatcher());

    @Nested
    @DisplayName("Episode heuristics")
    class EpisodeHeuristics {

        @ParameterizedTest(name = "{0} vs {1} episodes -> rejected={2}")
        @CsvSource({
                "12, 13, false",
                "24, 25, false",
                "0, 0, false",
                "2, 13, false",
                "1, 4, false",
                "1, 5, true",
                "1, 13, true"
        })
        @DisplayName("Should flag a special matched against a series")
        void testEpisodeBoundaries(int sourceEpisodes, int targetEpisodes, boolean rejected) {
            MediaEntry source = anime(1, 44983, "Some Show: The Movie", sourceEpisodes);
            MediaEntry target = anime(2, 28121, "Some Show", targetEpisodes);
            assertEquals(rejected, guard.isPotentiallyIncorrectMatch(source, target));
        }

        @Test
        @DisplayName("Agreeing MAL ids always pass")
        void testSameMalId() {
            MediaEntry source = anime(1, 500, "Movie", 1);
            MediaEntry target = anime(2, 500, "Series", 13);
            assertFalse(guard.isPotentiallyIncorrectMatch(source, target));
        }

        @Test
        @DisplayName("Identical titles always pass")
        void testIdenticalTitle() {
            MediaEntry source = anime(62550, 0, "Girls Band Cry", 1);
            MediaEntry target = anime(62551, 55102, "Girls Band Cry", 13);
            assertFalse(guard.isPotentiallyIncorrectMatch(source, target));
        }

        @Test
        @DisplayName("Should flag a source without MAL id against a target with one")
        void testNoMalId() {
            MediaEntry source = anime(1, 0, "テストアニメ (新作映画)", 1);
            MediaEntry target = anime(2, 12345, "テストアニメ", 1);
            assertEquals(Optional.of(MatchGuard.REASON_NO_MAL_ID), guard.incorrectMatchReason(source, target));
        }
    }

    @Nested
    @DisplayName("Should reject")
    class ShouldReject {

        @Test
        @DisplayName("Differing destination ids are rejected without a warning")
        void testDifferentIds() {
            SyncReport report = new SyncReport();
            MediaEntry source = anime(62550, 55102, "Girls Band Cry", 13);
            MediaEntry target = anime(62551, 62550, "Girls Band Cry", 13);
            assertTrue(guard.shouldReject(source, target, forward(report)));
            assertTrue(report.getWarnings().isEmpty());
        }

        @Test
        @DisplayName("Heuristic rejection reports a warning with unit counts")
        void testWarning() {
            SyncReport report = new SyncReport();
            ResolutionContext context = ResolutionContext.of(reverse().getOptions(), report);
            MediaEntry source = MediaEntry.anime().malId(44983).titleEnglish("Some Show: The Movie").totalUnits(1).build();
            MediaEntry target = anime(21000, 28121, "Some Show", 13);

            assertTrue(guard.shouldReject(source, target, context));

            assertEquals(1, report.getWarnings().size());
            MatchWarning warning = report.getWarnings().get(0);
            assertEquals("Some Show: The Movie", warning.title());
            assertEquals(MatchGuard.REASON_SPECIAL_VS_SERIES, warning.reason());
            assertEquals("(1 vs 13)", warning.detail());
        }

        @Test
        @DisplayName("Episode heuristics do not apply to manga")
        void testManga() {
            MediaEntry source = manga(1, 0, "Oneshot", 1, 1);
            MediaEntry target = manga(2, 700, "Series", 120, 12);
            assertFalse(guard.shouldReject(source, target, forward()));
        }
    }
}
