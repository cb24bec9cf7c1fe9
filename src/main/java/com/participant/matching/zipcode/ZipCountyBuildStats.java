package com.participant.matching.zipcode;

/**
 * Counters gathered while building a {@link ZipCountyMap}.
 *
 * @param collectionsScanned    reference collections whose ZIPs were read
 * @param totalZips             ZIPs assigned a county
 * @param singleCounty          ZIPs claimed by exactly one county
 * @param multiCounty           ZIPs claimed by several counties
 * @param authoritativeOverrides conflicts settled by the authoritative range table
 * @param denylistFallbacks     conflicts settled after dropping denylisted counties
 * @param alphabeticalFallbacks conflicts where every claimant was denylisted
 * @param outOfRegion           distinct values outside the service region
 * @param invalid               distinct values that are not ZIP codes
 */
public record ZipCountyBuildStats(
        int collectionsScanned,
        int totalZips,
        int singleCounty,
        int multiCounty,
        int authoritativeOverrides,
        int denylistFallbacks,
        int alphabeticalFallbacks,
        int outOfRegion,
        int invalid
) {
    @Override
    public String toString() {
        return "ZipCountyBuildStats{collections=" + collectionsScanned +
                ", zips=" + totalZips +
                ", single=" + singleCounty +
                ", multi=" + multiCounty +
                ", authoritative=" + authoritativeOverrides +
                ", denylist=" + denylistFallbacks +
                ", alphabetical=" + alphabeticalFallbacks +
                ", outOfRegion=" + outOfRegion +
                ", invalid=" + invalid + '}';
    }
}
