package com.participant.matching.zipcode;

import com.participant.matching.rules.IdentityNormalizer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers which county a participant ZIP belongs to. Read-only and safe to share across threads.
 */
public class ZipCountyResolver {

    private final ZipCountyMap map;
    private final IdentityNormalizer normalizer;

    public ZipCountyResolver(ZipCountyMap map, IdentityNormalizer normalizer) {
        this.map = Objects.requireNonNull(map, "map is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    public ZipCountyResolver(ZipCountyMap map) {
        this(map, IdentityNormalizer.defaults());
    }

    /**
     * Resolves a raw ZIP as entered by a participant ({@code "43065"}, {@code "43065-1234"},
     * {@code "43065.0"}). Empty when the ZIP is unusable or unknown.
     */
    public Optional<String> resolve(String rawZip) {
        String zip = normalizer.normalizeZip(rawZip);
        return zip == null ? Optional.empty() : map.countyFor(zip);
    }

    /**
     * All counties whose reference data contained the ZIP.
     */
    public List<String> claimants(String rawZip) {
        String zip = normalizer.normalizeZip(rawZip);
        return zip == null ? List.of() : map.claimantsFor(zip);
    }

    public int size() {
        return map.size();
    }

    public ZipCountyMap getMap() {
        return map;
    }
}
