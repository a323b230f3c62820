package com.media.resolution.api;

/**
 * Which optional strategies to compose into the chain. Exact-id and title matching are always on.
 * A strategy that is enabled but has no backing source configured is left out as well.
 */
public class StrategySettings {

    private final boolean manualMappings;
    private final boolean offlineDatabase;
    private final boolean armApi;
    private final boolean hatoApi;
    private final boolean foreignIdSearch;
    private final boolean apiSearch;

    private StrategySettings(Builder builder) {
        this.manualMappings = builder.manualMappings;
        this.offlineDatabase = builder.offlineDatabase;
        this.armApi = builder.armApi;
        this.hatoApi = builder.hatoApi;
        this.foreignIdSearch = builder.foreignIdSearch;
        this.apiSearch = builder.apiSearch;
    }

    public boolean isManualMappings() {
        return manualMappings;
    }

    public boolean isOfflineDatabase() {
        return offlineDatabase;
    }

    public boolean isArmApi() {
        return armApi;
    }

    public boolean isHatoApi() {
        return hatoApi;
    }

    public boolean isForeignIdSearch() {
        return foreignIdSearch;
    }

    public boolean isApiSearch() {
        return apiSearch;
    }

    public static StrategySettings allEnabled() {
        return builder().build();
    }

    /**
     * Only strategies that never leave the process: id, manual mappings, offline database and title.
     */
    public static StrategySettings offline() {
        return builder()
                .armApi(false)
                .hatoApi(false)
                .foreignIdSearch(false)
                .apiSearch(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean manualMappings = true;
        private boolean offlineDatabase = true;
        private boolean armApi = true;
        private boolean hatoApi = true;
        private boolean foreignIdSearch = true;
        private boolean apiSearch = true;

        public Builder manualMappings(boolean enabled) {
            this.manualMappings = enabled;
            return this;
        }

        public Builder offlineDatabase(boolean enabled) {
            this.offlineDatabase = enabled;
            return this;
        }

        public Builder armApi(boolean enabled) {
            this.armApi = enabled;
            return this;
        }

        public Builder hatoApi(boolean enabled) {
            this.hatoApi = enabled;
            return this;
        }

        public Builder foreignIdSearch(boolean enabled) {
            this.foreignIdSearch = enabled;
            return this;
        }

        public Builder apiSearch(boolean enabled) {
            this.apiSearch = enabled;
            return this;
        }

        public StrategySettings build() {
            return new StrategySettings(this);
        }
    }
}
