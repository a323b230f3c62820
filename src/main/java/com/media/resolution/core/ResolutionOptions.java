package com.media.resolution.core;

import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;

import java.util.Objects;

/**
 * Run flags for one pass: which direction and media kind to resolve,
 * whether to bypass matching, and whether to write anything.
 */
public class ResolutionOptions {

    private final SyncDirection direction;
    private final MediaKind mediaKind;
    private final boolean forceSync;
    private final boolean dryRun;

    private ResolutionOptions(Builder builder) {
        this.direction = builder.direction;
        this.mediaKind = builder.mediaKind;
        this.forceSync = builder.forceSync;
        this.dryRun = builder.dryRun;
    }

    public SyncDirection getDirection() {
        return direction;
    }

    public MediaKind getMediaKind() {
        return mediaKind;
    }

    /**
     * When set, every source is mapped to the foreign id it already carries and
     * is applied even if its progress looks unchanged.
     */
    public boolean isForceSync() {
        return forceSync;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Short label for logs, e.g. "forward anime".
     */
    public String describe() {
        return direction.getLabel() + " " + mediaKind.getLabel();
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ResolutionOptions options) {
        return new Builder()
                .direction(options.direction)
                .mediaKind(options.mediaKind)
                .forceSync(options.forceSync)
                .dryRun(options.dryRun);
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "direction=" + direction +
                ", mediaKind=" + mediaKind +
                ", forceSync=" + forceSync +
                ", dryRun=" + dryRun +
                '}';
    }

    public static class Builder {
        private SyncDirection direction = SyncDirection.FORWARD;
        private MediaKind mediaKind = MediaKind.ANIME;
        private boolean forceSync = false;
        private boolean dryRun = false;

        public Builder direction(SyncDirection direction) {
            this.direction = Objects.requireNonNull(direction, "direction is required");
            return this;
        }

        public Builder mediaKind(MediaKind mediaKind) {
            this.mediaKind = Objects.requireNonNull(mediaKind, "mediaKind is required");
            return this;
        }

        public Builder forceSync(boolean forceSync) {
            this.forceSync = forceSync;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }
    }
}
