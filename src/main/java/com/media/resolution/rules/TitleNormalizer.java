package com.media.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Lowercases a title, applies {@link TitleNormalizationRule}s in priority order,
 * then collapses whitespace and trims.
 */
public class TitleNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TitleNormalizer.class);

    private final List<TitleNormalizationRule> rules;

    public TitleNormalizer() {
        this(TitleNormalizationRules.defaults());
    }

    public TitleNormalizer(List<TitleNormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(TitleNormalizationRule::priority));
    }

    public List<TitleNormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }

        String result = title.toLowerCase(Locale.ROOT);
        for (TitleNormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return result.replaceAll("\\s+", " ").trim();
    }

    public boolean areEquivalent(String title1, String title2) {
        return normalize(title1).equals(normalize(title2));
    }
}
