package com.media.resolution.api;

import com.media.resolution.config.MappingsConfig;
import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.crosswalk.HatoClient;
import com.media.resolution.crosswalk.IdCrosswalk;
import com.media.resolution.metrics.MetricsService;
import com.media.resolution.metrics.NoOpMetricsService;
import com.media.resolution.rules.TitleNormalizer;
import com.media.resolution.service.DestinationService;
import com.media.resolution.similarity.TitleMatcher;
import com.media.resolution.strategy.ApiSearchStrategy;
import com.media.resolution.strategy.CrosswalkStrategy;
import com.media.resolution.strategy.ForeignIdSearchStrategy;
import com.media.resolution.strategy.IdStrategy;
import com.media.resolution.strategy.KnownTargets;
import com.media.resolution.strategy.ManualMappingStrategy;
import com.media.resolution.strategy.MatchGuard;
import com.media.resolution.strategy.MatchStrategy;
import com.media.resolution.strategy.StrategyChain;
import com.media.resolution.strategy.TitleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main entry point: resolves one catalog's list against the other's and applies the result.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MediaResolver resolver = MediaResolver.builder()
 *     .destinationService(malService)
 *     .mappings(MappingsConfig.load(Path.of("mappings.yaml")))
 *     .offlineDatabase(OfflineDatabase.load(dumpPath))
 *     .hatoCrosswalk(new HatoClient(new CrosswalkCache(cacheDir)))
 *     .build();
 *
 * ResolutionContext context = ResolutionContext.of(ResolutionOptions.builder()
 *     .direction(SyncDirection.FORWARD)
 *     .mediaKind(MediaKind.ANIME)
 *     .dryRun(true)
 *     .build(), new SyncReport());
 *
 * SyncResult result = resolver.sync(anilistEntries, malEntries, context);
 * </pre>
 *
 * <p>Strategies are composed in priority order: exact id, manual mapping, offline database,
 * ARM, Hato, title, foreign-id search, API search. Optional ones join the chain only when
 * enabled in {@link StrategySettings} and backed by a configured source.</p>
 */
public class MediaResolver {
    private static final Logger log = LoggerFactory.getLogger(MediaResolver.class);

    private final DestinationService destinationService;
    private final MappingsConfig mappings;
    private final MetricsService metricsService;
    private final TitleMatcher titleMatcher;
    private final StrategyChain chain;
    private final HatoClient hatoClient;

    private MediaResolver(Builder builder) {
        this.destinationService = builder.destinationService;
        this.mappings = builder.mappings != null ? builder.mappings : MappingsConfig.empty();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.titleMatcher = builder.titleMatcher != null ? builder.titleMatcher
                : new TitleMatcher(new TitleNormalizer(), TitleMatcher.DEFAULT_THRESHOLD);
        this.hatoClient = builder.hatoCrosswalk instanceof HatoClient hato ? hato : null;
        this.chain = compose(builder);
        log.info("MediaResolver initialized: strategies={}", chain.getStrategyNames());
    }

    private StrategyChain compose(Builder builder) {
        StrategySettings settings = builder.settings;
        MatchGuard guard = new MatchGuard(titleMatcher);
        List<MatchStrategy> strategies = new ArrayList<>();

        strategies.add(new IdStrategy());
        if (settings.isManualMappings() && mappings.hasManualMappings()) {
            strategies.add(new ManualMappingStrategy(mappings));
        }
        if (settings.isOfflineDatabase() && builder.offlineDatabase != null) {
            strategies.add(new CrosswalkStrategy(CrosswalkStrategy.OFFLINE_DATABASE, builder.offlineDatabase));
        }
        if (settings.isArmApi() && builder.armCrosswalk != null) {
            strategies.add(new CrosswalkStrategy(CrosswalkStrategy.ARM_API, builder.armCrosswalk));
        }
        if (settings.isHatoApi() && builder.hatoCrosswalk != null) {
            strategies.add(new CrosswalkStrategy(CrosswalkStrategy.HATO_API, builder.hatoCrosswalk));
        }
        strategies.add(new TitleStrategy(titleMatcher, guard));
        if (settings.isForeignIdSearch() && destinationService != null
                && destinationService.supportsForeignIdLookup()) {
            strategies.add(new ForeignIdSearchStrategy(destinationService, titleMatcher));
        }
        if (settings.isApiSearch() && destinationService != null) {
            strategies.add(new ApiSearchStrategy(destinationService, titleMatcher, guard));
        }
        return new StrategyChain(strategies);
    }

    public StrategyChain getStrategyChain() {
        return chain;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Resolves and deduplicates without touching the destination catalog.
     */
    public PassResult resolve(List<MediaEntry> sources, List<MediaEntry> targets, ResolutionContext context) {
        Map<TargetId, MediaEntry> knownTargets = KnownTargets.index(targets, context.getDirection());
        return newPass().run(sources, knownTargets, context);
    }

    /**
     * Resolves, deduplicates and applies the kept mappings.
     *
     * @throws IllegalStateException if no destination service is configured
     */
    public SyncResult sync(List<MediaEntry> sources, List<MediaEntry> targets, ResolutionContext context) {
        if (destinationService == null) {
            throw new IllegalStateException("sync requires a destination service");
        }
        PassResult pass = resolve(sources, targets, context);
        return new SyncUpdater(destinationService).apply(pass, context);
    }

    /**
     * Persists crosswalk lookups made during the run. Call once when all passes are done.
     */
    public void flushCaches() {
        if (hatoClient != null && hatoClient.saveCache()) {
            log.info("crosswalk.cache.flushed");
        }
    }

    private ResolutionPass newPass() {
        return new ResolutionPass(chain, new Deduplicator(titleMatcher), mappings, metricsService);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DestinationService destinationService;
        private MappingsConfig mappings;
        private IdCrosswalk offlineDatabase;
        private IdCrosswalk armCrosswalk;
        private IdCrosswalk hatoCrosswalk;
        private StrategySettings settings = StrategySettings.allEnabled();
        private MetricsService metricsService;
        private TitleMatcher titleMatcher;

        /**
         * Sets the destination catalog's API, used by the search strategies and to apply updates.
         */
        public Builder destinationService(DestinationService destinationService) {
            this.destinationService = destinationService;
            return this;
        }

        public Builder mappings(MappingsConfig mappings) {
            this.mappings = mappings;
            return this;
        }

        public Builder offlineDatabase(IdCrosswalk offlineDatabase) {
            this.offlineDatabase = offlineDatabase;
            return this;
        }

        public Builder armCrosswalk(IdCrosswalk armCrosswalk) {
            this.armCrosswalk = armCrosswalk;
            return this;
        }

        public Builder hatoCrosswalk(IdCrosswalk hatoCrosswalk) {
            this.hatoCrosswalk = hatoCrosswalk;
            return this;
        }

        public Builder strategySettings(StrategySettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Overrides title normalization and the similarity threshold.
         */
        public Builder titleMatcher(TitleMatcher titleMatcher) {
            this.titleMatcher = titleMatcher;
            return this;
        }

        public MediaResolver build() {
            return new MediaResolver(this);
        }
    }
}
