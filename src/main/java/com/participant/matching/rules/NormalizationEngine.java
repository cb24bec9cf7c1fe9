package com.participant.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ordered chain of {@link NormalizationRule}s producing the canonical form of a street line.
 * Not thread-safe while rules are being added or removed; read-only use is safe.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.name().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given value. Blank input yields an empty string.
     * Output is upper-case with single spaces and no leading or trailing whitespace.
     */
    public String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value.toUpperCase(Locale.ROOT);

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("address.rule.applied rule={} before={} after={}", rule.name(), before, result);
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }

    /**
     * True when both street lines share a canonical form.
     */
    public boolean areEquivalent(String value1, String value2) {
        return normalize(value1).equals(normalize(value2));
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }
}
