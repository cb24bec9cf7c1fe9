package com.participant.matching.zipcode;

import java.util.Map;
import java.util.Objects;

/**
 * A freshly built map together with how each ZIP was decided.
 */
public record ZipCountyBuildResult(
        ZipCountyMap map,
        Map<String, ZipResolution> resolutions,
        ZipCountyBuildStats stats
) {
    public ZipCountyBuildResult {
        Objects.requireNonNull(map, "map is required");
        Objects.requireNonNull(stats, "stats is required");
        resolutions = resolutions != null ? Map.copyOf(resolutions) : Map.of();
    }

    public ZipResolution resolutionOf(String zip5) {
        return resolutions.get(zip5);
    }
}
