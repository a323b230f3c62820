package com.media.resolution.similarity;

import com.media.resolution.core.model.MediaEntry;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.core.model.TargetId;
import com.media.resolution.rules.TitleNormalizer;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Compares the title variants of two entries at increasing levels of leniency.
 *
 * <p>Levels, each checked over the English, native and romaji pairs where both sides are set:</p>
 * <ol>
 *   <li>case-insensitive equality</li>
 *   <li>equality after normalization</li>
 *   <li>prefix similarity of the normalized titles at or above the threshold</li>
 *   <li>Levenshtein similarity of the normalized titles at or above the threshold</li>
 * </ol>
 */
public class TitleMatcher {

    public static final double DEFAULT_THRESHOLD = 0.98;

    private static final List<Function<MediaEntry, String>> VARIANTS = List.of(
            MediaEntry::getTitleEnglish,
            MediaEntry::getTitleNative,
            MediaEntry::getTitleRomaji
    );

    private final double threshold;
    private final List<BiPredicate<String, String>> levels;

    public TitleMatcher() {
        this(new TitleNormalizer(), DEFAULT_THRESHOLD);
    }

    public TitleMatcher(TitleNormalizer normalizer, double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0.0, 1.0]");
        }
        SimilarityAlgorithm prefix = new PrefixSimilarity();
        SimilarityAlgorithm levenshtein = new LevenshteinSimilarity();
        this.threshold = threshold;
        this.levels = List.of(
                String::equalsIgnoreCase,
                (a, b) -> normalizer.normalize(a).equals(normalizer.normalize(b)),
                (a, b) -> prefix.compute(normalizer.normalize(a), normalizer.normalize(b)) >= threshold,
                (a, b) -> levenshtein.compute(normalizer.normalize(a), normalizer.normalize(b)) >= threshold
        );
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Returns true if any title variant pair matches at any level.
     */
    public boolean sameTitle(MediaEntry source, MediaEntry target) {
        for (BiPredicate<String, String> level : levels) {
            if (anyVariant(source, target, level)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if any title variant pair is exactly equal.
     */
    public boolean identicalTitle(MediaEntry source, MediaEntry target) {
        return anyVariant(source, target, String::equals);
    }

    /**
     * Returns true if any title variant pair is equal ignoring case.
     */
    public boolean identicalTitleIgnoreCase(MediaEntry source, MediaEntry target) {
        return anyVariant(source, target, String::equalsIgnoreCase);
    }

    /**
     * Returns true if the target plausibly is the same work as the source.
     * Kinds must agree; then equal destination ids or a title match suffice.
     * Manga additionally accept equal known chapter and volume totals.
     */
    public boolean sameType(MediaEntry source, MediaEntry target, SyncDirection direction) {
        if (source.getKind() != target.getKind()) {
            return false;
        }
        TargetId sourceForeign = direction.targetId(source);
        if (sourceForeign.isPresent() && sourceForeign.equals(direction.targetId(target))) {
            return true;
        }
        if (sameTitle(source, target)) {
            return true;
        }
        return source.getKind() == MediaKind.MANGA
                && source.getTotalUnits() > 0
                && source.getTotalUnits() == target.getTotalUnits()
                && source.getTotalVolumes() == target.getTotalVolumes();
    }

    private static boolean anyVariant(MediaEntry source, MediaEntry target, BiPredicate<String, String> test) {
        for (Function<MediaEntry, String> variant : VARIANTS) {
            String a = variant.apply(source);
            String b = variant.apply(target);
            if (!a.isEmpty() && !b.isEmpty() && test.test(a, b)) {
                return true;
            }
        }
        return false;
    }
}
