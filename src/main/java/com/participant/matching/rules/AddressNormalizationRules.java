package com.participant.matching.rules;

import java.util.List;

/**
 * Built-in rules for U.S. street addresses. Every street suffix and directional,
 * spelled out or abbreviated, is rewritten to one canonical token, and numbered
 * state and U.S. routes to one spelling.
 */
public final class AddressNormalizationRules {

    private AddressNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all address rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getPunctuationRules());
        engine.addRules(getRouteRules());
        engine.addRules(getSuffixRules());
        engine.addRules(getDirectionalRules());
        return engine;
    }

    /**
     * Punctuation that carries no meaning in a street line ("MAIN ST." vs "MAIN ST").
     * The key separator is stripped too so a street can never forge a ZIP part.
     */
    public static List<NormalizationRule> getPunctuationRules() {
        return List.of(
                NormalizationRule.of("punctuation-strip", "[,.|]", " ", 10)
        );
    }

    /**
     * Numbered highways. {@code OH-314}, {@code SR 314} and {@code STATE ROUTE 314} become
     * {@code SR 314}; {@code US-40} and {@code US HIGHWAY 40} become {@code US 40}.
     * Runs before the suffix rules, which would otherwise turn {@code STATE ROUTE} into
     * {@code STATE RTE}.
     */
    public static List<NormalizationRule> getRouteRules() {
        return List.of(
                NormalizationRule.of("route-state",
                        "\\b(?:OH|SR|STATE\\s+(?:ROUTE|RTE|RT))[-\\s]*(\\d+)\\b", "SR $1", 20),
                NormalizationRule.of("route-us",
                        "\\bU\\s?S[-\\s]*(?:(?:HIGHWAY|HWY|ROUTE|RTE)[-\\s]*)?(\\d+)\\b", "US $1", 20)
        );
    }

    /**
     * Street suffix rules.
     */
    public static List<NormalizationRule> getSuffixRules() {
        return List.of(
                NormalizationRule.canonicalWord("suffix-street", "ST", 50, "STREET", "ST"),
                NormalizationRule.canonicalWord("suffix-avenue", "AV", 50, "AVENUE", "AVE", "AV"),
                NormalizationRule.canonicalWord("suffix-road", "RD", 50, "ROAD", "RD"),
                NormalizationRule.canonicalWord("suffix-drive", "DR", 50, "DRIVE", "DR"),
                NormalizationRule.canonicalWord("suffix-lane", "LN", 50, "LANE", "LN"),
                NormalizationRule.canonicalWord("suffix-court", "CT", 50, "COURT", "CT"),
                NormalizationRule.canonicalWord("suffix-circle", "CIR", 50, "CIRCLE", "CIR"),
                NormalizationRule.canonicalWord("suffix-boulevard", "BLVD", 50, "BOULEVARD", "BLVD"),
                NormalizationRule.canonicalWord("suffix-parkway", "PKWY", 50, "PARKWAY", "PKWY"),
                NormalizationRule.canonicalWord("suffix-place", "PL", 50, "PLACE", "PL"),
                NormalizationRule.canonicalWord("suffix-terrace", "TER", 50, "TERRACE", "TER"),
                NormalizationRule.canonicalWord("suffix-highway", "HWY", 50, "HIGHWAY", "HWY"),
                NormalizationRule.canonicalWord("suffix-route", "RTE", 50, "ROUTE", "RTE"),
                NormalizationRule.canonicalWord("suffix-trail", "TRL", 50, "TRAIL", "TRL")
        );
    }

    /**
     * Directional rules. Compound directionals are separate words, so
     * "NORTHEAST" is never split by the "NORTH" rule.
     */
    public static List<NormalizationRule> getDirectionalRules() {
        return List.of(
                NormalizationRule.canonicalWord("dir-northeast", "NE", 60, "NORTHEAST", "NE"),
                NormalizationRule.canonicalWord("dir-northwest", "NW", 60, "NORTHWEST", "NW"),
                NormalizationRule.canonicalWord("dir-southeast", "SE", 60, "SOUTHEAST", "SE"),
                NormalizationRule.canonicalWord("dir-southwest", "SW", 60, "SOUTHWEST", "SW"),
                NormalizationRule.canonicalWord("dir-north", "N", 60, "NORTH", "N"),
                NormalizationRule.canonicalWord("dir-south", "S", 60, "SOUTH", "S"),
                NormalizationRule.canonicalWord("dir-east", "E", 60, "EAST", "E"),
                NormalizationRule.canonicalWord("dir-west", "W", 60, "WEST", "W")
        );
    }
}
