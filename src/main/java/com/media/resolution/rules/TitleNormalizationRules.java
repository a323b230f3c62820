package com.media.resolution.rules;

import java.util.List;

/**
 * Default rules for catalog titles.
 */
public final class TitleNormalizationRules {

    private TitleNormalizationRules() {
    }

    public static List<TitleNormalizationRule> defaults() {
        return List.of(
                // "(TV)", "(新作映画)", "(2019)"; greedy up to the last closing bracket
                TitleNormalizationRule.of("bracketed-qualifier", "\\(.*\\)", "", 10),
                TitleNormalizationRule.of("punctuation", "[:!?'\"]", "", 20),
                TitleNormalizationRule.of("separators", "[-_.,]", " ", 30)
        );
    }
}
