package com.participant.matching.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching one participant against the reference data.
 * Exactly one result is produced per participant per run.
 *
 * @param participant        the participant that was matched
 * @param matchQuality       identity signal that produced the match
 * @param matchMethod        free-form descriptor of how the result was reached
 * @param countyName         attributed county, empty when none could be determined
 * @param demographicRecord  matched demographic record, may be null
 * @param residentialRecord  matched residential record, may be null
 */
public record MatchResult(
        Participant participant,
        MatchQuality matchQuality,
        String matchMethod,
        String countyName,
        DemographicRecord demographicRecord,
        ResidentialRecord residentialRecord
) {
    public static final String METHOD_ZIPCODE_COUNTY = "zipcode_county";
    public static final String METHOD_NO_COUNTY = "no_county";
    public static final String METHOD_NO_ZIPCODE = "no_zipcode";

    public MatchResult {
        Objects.requireNonNull(participant, "participant is required");
        Objects.requireNonNull(matchQuality, "matchQuality is required");
        Objects.requireNonNull(matchMethod, "matchMethod is required");
        countyName = countyName != null ? countyName : "";
        if (matchQuality.isMatch() && demographicRecord == null && residentialRecord == null) {
            throw new IllegalArgumentException("A " + matchQuality + " match requires a reference record");
        }
    }

    /**
     * Creates a match backed by reference records. The county is taken from the records.
     */
    public static MatchResult matched(Participant participant, MatchQuality quality,
                                      DemographicRecord demographic, ResidentialRecord residential) {
        if (!quality.isMatch()) {
            throw new IllegalArgumentException("Use noMatch() for " + quality);
        }
        String county = demographic != null ? demographic.county()
                : residential != null ? residential.county() : null;
        return new MatchResult(participant, quality, quality.getLabel(), county, demographic, residential);
    }

    /**
     * Creates a no-match result, optionally attributed to a county by ZIP.
     */
    public static MatchResult noMatch(Participant participant, String matchMethod, String countyName) {
        return new MatchResult(participant, MatchQuality.NO_MATCH, matchMethod, countyName, null, null);
    }

    public boolean isMatched() {
        return matchQuality.isMatch();
    }

    public boolean hasCounty() {
        return !countyName.isEmpty();
    }

    public Optional<DemographicRecord> demographic() {
        return Optional.ofNullable(demographicRecord);
    }

    public Optional<ResidentialRecord> residential() {
        return Optional.ofNullable(residentialRecord);
    }
}
