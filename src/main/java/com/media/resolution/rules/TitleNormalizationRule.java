package com.media.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to lowercased titles before fuzzy comparison.
 * Rules run in ascending priority.
 *
 * @param name        identifies the rule in trace logs
 * @param pattern     what to replace, matched case-insensitively
 * @param replacement replacement text, may reference groups
 * @param priority    lower runs first
 */
public record TitleNormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public TitleNormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static TitleNormalizationRule of(String name, String regex, String replacement, int priority) {
        Objects.requireNonNull(regex, "regex is required");
        return new TitleNormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement, priority);
    }

    public String apply(String title) {
        return title == null ? null : pattern.matcher(title).replaceAll(replacement);
    }
}
