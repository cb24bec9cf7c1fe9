package com.participant.matching.source;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A reference collection name split into its county and data type.
 *
 * @param name   the collection name as stored
 * @param county the county the collection belongs to, always ending in {@code County}
 * @param kind   demographic or residential
 */
public record ReferenceCollection(String name, String county, Kind kind) {

    public static final String DEMOGRAPHIC_SUFFIX = "Demographic";
    public static final String RESIDENTIAL_SUFFIX = "Residential";
    private static final String COUNTY_SUFFIX = "County";

    /**
     * Counties alphabetically, demographic before residential within a county.
     */
    public static final Comparator<ReferenceCollection> LOAD_ORDER =
            Comparator.comparing(ReferenceCollection::county).thenComparing(ReferenceCollection::kind);

    public enum Kind { DEMOGRAPHIC, RESIDENTIAL }

    public ReferenceCollection {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(county, "county is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    /**
     * Parses a collection name. Names without a data-type suffix are not reference collections.
     * {@code AthensDemographic} and {@code AthensCountyDemographic} both map to {@code AthensCounty}.
     */
    public static Optional<ReferenceCollection> parse(String collectionName) {
        if (collectionName == null) {
            return Optional.empty();
        }
        Kind kind;
        String prefix;
        if (collectionName.endsWith(DEMOGRAPHIC_SUFFIX)) {
            kind = Kind.DEMOGRAPHIC;
            prefix = collectionName.substring(0, collectionName.length() - DEMOGRAPHIC_SUFFIX.length());
        } else if (collectionName.endsWith(RESIDENTIAL_SUFFIX)) {
            kind = Kind.RESIDENTIAL;
            prefix = collectionName.substring(0, collectionName.length() - RESIDENTIAL_SUFFIX.length());
        } else {
            return Optional.empty();
        }
        if (prefix.isBlank()) {
            return Optional.empty();
        }
        String county = prefix.endsWith(COUNTY_SUFFIX) ? prefix : prefix + COUNTY_SUFFIX;
        return Optional.of(new ReferenceCollection(collectionName, county, kind));
    }
}
