package com.participant.matching.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to street addresses before they are used as index keys.
 * Lower priorities run first. Patterns are matched case-insensitively.
 *
 * @param name        unique rule name, used to remove a rule from an engine
 * @param pattern     compiled pattern
 * @param replacement replacement text, may use group references
 * @param priority    position in the chain
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public static final int DEFAULT_PRIORITY = 100;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        Objects.requireNonNull(regex, "regex is required");
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, priority);
    }

    public static NormalizationRule of(String name, String regex, String replacement) {
        return of(name, regex, replacement, DEFAULT_PRIORITY);
    }

    /**
     * Whole-word rule mapping every variant to one canonical token.
     * The canonical token should be one of the variants so the rule stays idempotent.
     */
    public static NormalizationRule canonicalWord(String name, String canonical, int priority, String... variants) {
        if (variants.length == 0) {
            throw new IllegalArgumentException("At least one variant is required for " + name);
        }
        StringBuilder alternation = new StringBuilder();
        for (String variant : variants) {
            if (!alternation.isEmpty()) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(variant));
        }
        return of(name, "\\b(?:" + alternation + ")\\b", canonical, priority);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return "NormalizationRule{name='" + name + "', pattern=" + pattern.pattern() + ", priority=" + priority + '}';
    }
}
