package com.participant.matching.zipcode;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The ZIP to county assignment, as persisted in the cache file.
 *
 * @param zipcodeMap  five-digit ZIP to its single assigned county
 * @param multiCounty ZIPs claimed by several counties, with every claimant in sorted order
 */
@JsonPropertyOrder({"zipcode_map", "multi_county"})
public record ZipCountyMap(
        @JsonProperty("zipcode_map") Map<String, String> zipcodeMap,
        @JsonProperty("multi_county") Map<String, List<String>> multiCounty
) {
    public ZipCountyMap {
        zipcodeMap = Collections.unmodifiableMap(new TreeMap<>(zipcodeMap != null ? zipcodeMap : Map.of()));
        TreeMap<String, List<String>> conflicts = new TreeMap<>();
        if (multiCounty != null) {
            multiCounty.forEach((zip, counties) -> conflicts.put(zip, List.copyOf(counties)));
        }
        multiCounty = Collections.unmodifiableMap(conflicts);
    }

    public static ZipCountyMap empty() {
        return new ZipCountyMap(Map.of(), Map.of());
    }

    public Optional<String> countyFor(String zip5) {
        return Optional.ofNullable(zipcodeMap.get(zip5));
    }

    public List<String> claimantsFor(String zip5) {
        List<String> claimants = multiCounty.get(zip5);
        if (claimants != null) {
            return claimants;
        }
        String county = zipcodeMap.get(zip5);
        return county != null ? List.of(county) : List.of();
    }

    @JsonIgnore
    public int size() {
        return zipcodeMap.size();
    }
}
