package com.participant.matching.zipcode;

/**
 * Inclusive range of ZIP codes considered plausible for the service region.
 * ZIPs outside it are treated as contamination in the source data.
 */
public record ZipRegion(int min, int max) {

    /**
     * Ohio: 43000 through 45999.
     */
    public static final ZipRegion OHIO = new ZipRegion(43_000, 45_999);

    public ZipRegion {
        if (min < 0 || max > 99_999 || min > max) {
            throw new IllegalArgumentException("Invalid ZIP region " + min + ".." + max);
        }
    }

    public boolean contains(int zip) {
        return zip >= min && zip <= max;
    }
}
