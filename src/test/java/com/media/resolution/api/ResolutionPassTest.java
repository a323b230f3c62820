package com.media.resolution.api;

import com.media.resolution.config.IgnoreRules;
import com.media.resolution.config.MappingsConfig;
import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.ResolutionOptions;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.ResolvedMapping;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.metrics.MetricsService;
import com.media.resolution.report.SyncReport;
import com.media.resolution.report.UnmappedEntry;
import com.media.resolution.similarity.TitleMatcher;
import com.media.resolution.strategy.IdStrategy;
import com.media.resolution.strategy.MatchGuard;
import com.media.resolution.strategy.MatchStrategy;
import com.media.resolution.strategy.StrategyChain;
import com.media.resolution.strategy.TitleStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.media.resolution.MediaFixtures.anime;
import static com.media.resolution.MediaFixtures.forward;
import static com.media.resolution.MediaFixtures.known;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResolutionPassTest {

    @Mock
    private MetricsService metrics;

    private final TitleMatcher matcher = new TitleMatcher();
    private StrategyChain chain;

    private final MediaEntry target = anime(0, 10, "Alpha", 12);
    private final MediaEntry byId = anime(1, 10, "Alpha Season", 12);
    private final MediaEntry byTitle = anime(2, 0, "Alpha", 12);
    private final MediaEntry unmatched = anime(3, 0, "Nothing Like It", 12);
    private final MediaEntry noStatus = MediaEntry.anime().anilistId(4).malId(10).titleEnglish("Alpha").build();

    @BeforeEach
    void setUp() {
        chain = new StrategyChain(List.of(new IdStrategy(), new TitleStrategy(matcher, new MatchGuard(matcher))));
    }

    private ResolutionPass pass(MappingsConfig mappings) {
        return new ResolutionPass(chain, new Deduplicator(matcher), mappings, metrics);
    }

    private ResolutionPass pass() {
        return pass(MappingsConfig.empty());
    }

    @Nested
    @DisplayName("Run")
    class Run {

        @Test
        @DisplayName("Should resolve, deduplicate and report")
        void testFullPass() {
            SyncReport report = new SyncReport();
            ResolutionPass pass = pass();

            PassResult result = pass.run(List.of(byId, byTitle, unmatched, noStatus),
                    known(SyncDirection.FORWARD, target), forward(report));

            assertEquals(PassState.DONE, pass.getState());
            assertFalse(result.truncated());
            assertEquals(1, result.mappings().size());
            assertSame(byId, result.mappings().get(0).source());
            assertEquals(1, result.conflicts().size());
            assertSame(byTitle, result.conflicts().get(0).loser().source());

            assertEquals(List.of("Nothing Like It", "Alpha"),
                    result.unmapped().stream().map(UnmappedEntry::title).toList());
            assertEquals("no match found", result.unmapped().get(0).reason());
            assertTrue(result.unmapped().get(1).reason().startsWith("duplicate:"));
            assertEquals(report.getUnmapped(), result.unmapped());
            assertEquals(1, report.getConflicts().size());

            assertEquals(3, result.statistics().getTotalCount());
            assertEquals(2, result.statistics().getSkippedCount());

            verify(metrics).incrementResolved(IdStrategy.NAME);
            verify(metrics).incrementResolved(TitleStrategy.NAME);
            verify(metrics).incrementNotFound(MediaKind.ANIME);
            verify(metrics).incrementConflict(MediaKind.ANIME);
            verify(metrics).recordMappingCount(1);
            verify(metrics).recordPassDuration(eq(MediaKind.ANIME), eq(SyncDirection.FORWARD), any());
        }

        @Test
        @DisplayName("Should refuse to run twice")
        void testRerun() {
            ResolutionPass pass = pass();
            pass.run(List.of(), Map.of(), forward());

            assertThrows(IllegalStateException.class, () -> pass.run(List.of(), Map.of(), forward()));
            assertEquals(PassState.DONE, pass.getState());
        }

        @Test
        @DisplayName("Should skip ignored sources by id or title")
        void testIgnored() {
            MappingsConfig mappings = new MappingsConfig(List.of(),
                    new IgnoreRules(List.of(1), null, List.of("nothing like it")));

            PassResult result = pass(mappings).run(List.of(byId, unmatched),
                    known(SyncDirection.FORWARD, target), forward());

            assertTrue(result.mappings().isEmpty());
            assertTrue(result.unmapped().isEmpty());
            assertEquals(2, result.statistics().getTotalCount());
            assertTrue(result.statistics().getSkippedItems().stream()
                    .allMatch(r -> ResolutionPass.REASON_IGNORED.equals(r.skipReason())));
        }
    }

    @Nested
    @DisplayName("Force sync")
    class ForceSync {

        @Test
        @DisplayName("Should map every source to the foreign id it carries")
        void testForceSync() {
            ResolutionContext context = ResolutionContext.of(ResolutionOptions.builder().forceSync(true).build());
            MediaEntry untracked = anime(5, 99, "Untracked", 24);

            PassResult result = pass().run(List.of(byId, untracked, unmatched),
                    known(SyncDirection.FORWARD, target), context);

            assertEquals(2, result.mappings().size());
            ResolvedMapping tracked = result.mappings().get(0);
            assertSame(target, tracked.target());
            assertEquals(ResolutionPass.FORCE_SYNC, tracked.strategyName());
            assertEquals(0, tracked.strategyIndex());

            ResolvedMapping fresh = result.mappings().get(1);
            assertSame(untracked, fresh.target());
            assertEquals(TargetId.of(99), fresh.targetId());

            assertEquals(1, result.unmapped().size());
            assertEquals("Nothing Like It", result.unmapped().get(0).title());
        }
    }

    @Nested
    @DisplayName("Failures and cancellation")
    class Failures {

        @Test
        @DisplayName("A failing strategy leaves the source unmapped and the pass continues")
        void testStrategyFailure() {
            MatchStrategy failing = new MatchStrategy() {
                @Override
                public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                                       ResolutionContext context) {
                    if (source == unmatched) {
                        throw new IllegalStateException("HTTP 503");
                    }
                    return Optional.empty();
                }

                @Override
                public String getName() {
                    return "Flaky";
                }
            };
            chain = new StrategyChain(List.of(new IdStrategy(), failing));

            PassResult result = pass().run(List.of(unmatched, byId), known(SyncDirection.FORWARD, target), forward());

            assertEquals(1, result.mappings().size());
            assertEquals("strategy Flaky failed: HTTP 503", result.unmapped().get(0).reason());
            verify(metrics).incrementStrategyFailure("Flaky");
        }

        @Test
        @DisplayName("Cancellation keeps the mappings found so far")
        void testCancellation() {
            ResolutionContext context = forward();
            MatchStrategy cancelling = new MatchStrategy() {
                @Override
                public Optional<MediaEntry> findTarget(MediaEntry source, Map<TargetId, MediaEntry> knownTargets,
                                                       ResolutionContext ctx) {
                    ctx.cancel();
                    return Optional.of(target);
                }

                @Override
                public String getName() {
                    return "Cancelling";
                }
            };
            chain = new StrategyChain(List.of(cancelling));
            ResolutionPass pass = pass();

            PassResult result = pass.run(List.of(byId, unmatched), known(SyncDirection.FORWARD, target), context);

            assertTrue(result.truncated());
            assertEquals(1, result.mappings().size());
            assertEquals(1, result.statistics().getTotalCount());
            assertEquals(PassState.DONE, pass.getState());
        }
    }
}
