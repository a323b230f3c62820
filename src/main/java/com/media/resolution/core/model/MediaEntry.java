package com.media.resolution.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One list entry from either catalog.
 * Immutable; the {@link MediaKind} discriminant decides whether the unit
 * counters mean episodes (anime) or chapters (manga).
 */
public final class MediaEntry {
    private final MediaKind kind;
    private final int anilistId;
    private final int malId;
    private final String titleEnglish;
    private final String titleNative;
    private final String titleRomaji;
    private final ListStatus status;
    private final double score;
    private final int progress;
    private final int progressVolumes;
    private final int totalUnits;
    private final int totalVolumes;
    private final int seasonYear;
    private final LocalDate startedAt;
    private final LocalDate finishedAt;

    private MediaEntry(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.anilistId = Math.max(0, builder.anilistId);
        this.malId = Math.max(0, builder.malId);
        this.titleEnglish = nullToEmpty(builder.titleEnglish);
        this.titleNative = nullToEmpty(builder.titleNative);
        this.titleRomaji = nullToEmpty(builder.titleRomaji);
        this.status = builder.status;
        this.score = builder.score;
        this.progress = builder.progress;
        this.progressVolumes = builder.progressVolumes;
        this.totalUnits = builder.totalUnits;
        this.totalVolumes = builder.totalVolumes;
        this.seasonYear = builder.seasonYear;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public MediaKind getKind() {
        return kind;
    }

    public int getAnilistId() {
        return anilistId;
    }

    public int getMalId() {
        return malId;
    }

    /**
     * Returns the id of this entry in the given catalog, 0 when unknown.
     */
    public int idIn(CatalogService service) {
        return service == CatalogService.ANILIST ? anilistId : malId;
    }

    public String getTitleEnglish() {
        return titleEnglish;
    }

    public String getTitleNative() {
        return titleNative;
    }

    public String getTitleRomaji() {
        return titleRomaji;
    }

    /**
     * Primary display title: English, then native, then romaji.
     */
    public String getTitle() {
        if (!titleEnglish.isEmpty()) {
            return titleEnglish;
        }
        if (!titleNative.isEmpty()) {
            return titleNative;
        }
        return titleRomaji;
    }

    public ListStatus getStatus() {
        return status;
    }

    public boolean hasStatus() {
        return status != null;
    }

    public double getScore() {
        return score;
    }

    public int getProgress() {
        return progress;
    }

    public int getProgressVolumes() {
        return progressVolumes;
    }

    /**
     * Episodes for anime, chapters for manga. 0 when unknown.
     */
    public int getTotalUnits() {
        return totalUnits;
    }

    public int getTotalVolumes() {
        return totalVolumes;
    }

    public int getSeasonYear() {
        return seasonYear;
    }

    public LocalDate getStartedAt() {
        return startedAt;
    }

    public LocalDate getFinishedAt() {
        return finishedAt;
    }

    /**
     * Returns true if applying this entry to {@code target} would change nothing
     * the destination catalog tracks.
     */
    public boolean sameProgressAs(MediaEntry target) {
        if (status != target.status || Double.compare(score, target.score) != 0) {
            return false;
        }
        return switch (kind) {
            case ANIME -> sameEpisodeProgress(target);
            case MANGA -> progress == target.progress && progressVolumes == target.progressVolumes;
        };
    }

    private boolean sameEpisodeProgress(MediaEntry target) {
        if (totalUnits == target.totalUnits || totalUnits == 0 || target.totalUnits == 0) {
            return progress == target.progress;
        }
        if (progress == target.progress) {
            return true;
        }
        // catalogs disagree on the total, compare what is left to watch
        return totalUnits - progress == target.totalUnits - target.progress;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MediaEntry that = (MediaEntry) o;
        return kind == that.kind
                && anilistId == that.anilistId
                && malId == that.malId
                && Objects.equals(getTitle(), that.getTitle());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, anilistId, malId, getTitle());
    }

    @Override
    public String toString() {
        return "MediaEntry{" +
                "kind=" + kind +
                ", anilistId=" + anilistId +
                ", malId=" + malId +
                ", title='" + getTitle() + '\'' +
                ", status=" + status +
                ", progress=" + progress + "/" + totalUnits +
                '}';
    }

    public static Builder builder(MediaKind kind) {
        return new Builder().kind(kind);
    }

    public static Builder anime() {
        return builder(MediaKind.ANIME);
    }

    public static Builder manga() {
        return builder(MediaKind.MANGA);
    }

    public static class Builder {
        private MediaKind kind;
        private int anilistId;
        private int malId;
        private String titleEnglish;
        private String titleNative;
        private String titleRomaji;
        private ListStatus status;
        private double score;
        private int progress;
        private int progressVolumes;
        private int totalUnits;
        private int totalVolumes;
        private int seasonYear;
        private LocalDate startedAt;
        private LocalDate finishedAt;

        public Builder kind(MediaKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder anilistId(int anilistId) {
            this.anilistId = anilistId;
            return this;
        }

        public Builder malId(int malId) {
            this.malId = malId;
            return this;
        }

        public Builder titleEnglish(String titleEnglish) {
            this.titleEnglish = titleEnglish;
            return this;
        }

        public Builder titleNative(String titleNative) {
            this.titleNative = titleNative;
            return this;
        }

        public Builder titleRomaji(String titleRomaji) {
            this.titleRomaji = titleRomaji;
            return this;
        }

        public Builder status(ListStatus status) {
            this.status = status;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder progressVolumes(int progressVolumes) {
            this.progressVolumes = progressVolumes;
            return this;
        }

        public Builder totalUnits(int totalUnits) {
            this.totalUnits = totalUnits;
            return this;
        }

        public Builder totalVolumes(int totalVolumes) {
            this.totalVolumes = totalVolumes;
            return this;
        }

        public Builder seasonYear(int seasonYear) {
            this.seasonYear = seasonYear;
            return this;
        }

        public Builder startedAt(LocalDate startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(LocalDate finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public MediaEntry build() {
            return new MediaEntry(this);
        }
    }
}
