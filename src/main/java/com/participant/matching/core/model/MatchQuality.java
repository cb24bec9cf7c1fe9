package com.participant.matching.core.model;

/**
 * Identity signal that resolved a participant, strongest first.
 * Declaration order is the resolution priority.
 */
public enum MatchQuality {
    /**
     * Matched on normalized email. Lowest false-positive rate.
     */
    EMAIL("email"),

    /**
     * Matched on normalized 10-digit phone number.
     */
    PHONE("phone"),

    /**
     * Matched on normalized street address plus ZIP.
     * Highest collision risk because of formatting variance.
     */
    ADDRESS("address"),

    /**
     * No reference record found. The county may still be attributed from the ZIP.
     */
    NO_MATCH("no_match");

    private final String label;

    MatchQuality(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMatch() {
        return this != NO_MATCH;
    }

    /**
     * Returns true if this quality outranks the other one.
     */
    public boolean isStrongerThan(MatchQuality other) {
        return ordinal() < other.ordinal();
    }
}
