package com.participant.matching.zipcode;

import com.participant.matching.metrics.MetricsService;
import com.participant.matching.metrics.NoOpMetricsService;
import com.participant.matching.source.ReferenceCollection;
import com.participant.matching.source.ReferenceDataSource;
import com.participant.matching.source.ReferenceRecordMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives the ZIP to county map from the ZIPs each county collection contains.
 *
 * <p>A ZIP claimed by one county goes to that county. A ZIP claimed by several
 * counties is settled, in order, by:</p>
 * <ol>
 *   <li>the first authoritative range containing the ZIP whose county is a claimant</li>
 *   <li>the alphabetically first claimant that is not denylisted</li>
 *   <li>the alphabetically first claimant, when all are denylisted</li>
 * </ol>
 */
public class ZipCountyMapBuilder {
    private static final Logger log = LoggerFactory.getLogger(ZipCountyMapBuilder.class);

    private final AuthoritativeZipTable authoritativeTable;
    private final ZipRegion region;
    private final Set<String> denylist;
    private final MetricsService metricsService;

    public ZipCountyMapBuilder(AuthoritativeZipTable authoritativeTable, ZipRegion region,
                               Set<String> denylist, MetricsService metricsService) {
        this.authoritativeTable = Objects.requireNonNull(authoritativeTable, "authoritativeTable is required");
        this.region = Objects.requireNonNull(region, "region is required");
        this.denylist = denylist != null ? Set.copyOf(denylist) : Set.of();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public ZipCountyMapBuilder(AuthoritativeZipTable authoritativeTable, ZipRegion region, Set<String> denylist) {
        this(authoritativeTable, region, denylist, null);
    }

    /**
     * Reads the distinct {@code parcel_zip} values of every reference collection and builds the map.
     */
    public ZipCountyBuildResult build(ReferenceDataSource source) {
        log.info("zip.build.started source={}", source.getName());
        Map<String, List<Object>> zipsByCounty = new TreeMap<>();
        int collections = 0;
        for (String name : source.listCollections()) {
            var collection = ReferenceCollection.parse(name);
            if (collection.isEmpty()) {
                log.debug("zip.build.collectionSkipped collection={}", name);
                continue;
            }
            collections++;
            Set<Object> values = source.distinctValues(name, ReferenceRecordMapper.FIELD_PARCEL_ZIP);
            log.debug("zip.build.collectionScanned collection={} county={} distinctValues={}",
                    name, collection.get().county(), values.size());
            zipsByCounty.computeIfAbsent(collection.get().county(), k -> new ArrayList<>()).addAll(values);
        }
        return build(zipsByCounty, collections);
    }

    /**
     * Builds the map from raw ZIP values already grouped by county.
     */
    public ZipCountyBuildResult build(Map<String, ? extends Collection<?>> rawZipsByCounty) {
        return build(rawZipsByCounty, rawZipsByCounty.size());
    }

    private ZipCountyBuildResult build(Map<String, ? extends Collection<?>> rawZipsByCounty, int collections) {
        Map<String, Set<String>> claimants = new TreeMap<>();
        int outOfRegion = 0;
        int invalid = 0;

        for (var entry : rawZipsByCounty.entrySet()) {
            String county = entry.getKey();
            for (Object raw : entry.getValue()) {
                OptionalInt zip = ZipCodes.parse(raw);
                if (zip.isEmpty()) {
                    invalid++;
                    continue;
                }
                if (!region.contains(zip.getAsInt())) {
                    outOfRegion++;
                    log.trace("zip.build.outOfRegion county={} zip={}", county, zip.getAsInt());
                    continue;
                }
                claimants.computeIfAbsent(ZipCodes.format(zip.getAsInt()), k -> new TreeSet<>()).add(county);
            }
        }

        Map<String, String> assigned = new LinkedHashMap<>();
        Map<String, List<String>> conflicts = new LinkedHashMap<>();
        Map<String, ZipResolution> resolutions = new HashMap<>();
        int[] counts = new int[ZipResolution.values().length];

        for (var entry : claimants.entrySet()) {
            String zip = entry.getKey();
            List<String> counties = new ArrayList<>(entry.getValue());
            ZipResolution resolution;
            String county;
            if (counties.size() == 1) {
                resolution = ZipResolution.SINGLE_COUNTY;
                county = counties.get(0);
            } else {
                conflicts.put(zip, counties);
                String authoritative = authoritativeChoice(Integer.parseInt(zip), counties);
                if (authoritative != null) {
                    resolution = ZipResolution.AUTHORITATIVE_OVERRIDE;
                    county = authoritative;
                } else {
                    List<String> allowed = counties.stream().filter(c -> !denylist.contains(c)).toList();
                    if (!allowed.isEmpty()) {
                        resolution = ZipResolution.DENYLIST_FALLBACK;
                        county = allowed.get(0);
                    } else {
                        resolution = ZipResolution.ALPHABETICAL_FALLBACK;
                        county = counties.get(0);
                    }
                }
                log.debug("zip.build.conflict zip={} claimants={} county={} resolution={}",
                        zip, counties, county, resolution);
            }
            assigned.put(zip, county);
            resolutions.put(zip, resolution);
            counts[resolution.ordinal()]++;
            metricsService.incrementZipResolution(resolution);
        }

        var stats = new ZipCountyBuildStats(
                collections,
                assigned.size(),
                counts[ZipResolution.SINGLE_COUNTY.ordinal()],
                conflicts.size(),
                counts[ZipResolution.AUTHORITATIVE_OVERRIDE.ordinal()],
                counts[ZipResolution.DENYLIST_FALLBACK.ordinal()],
                counts[ZipResolution.ALPHABETICAL_FALLBACK.ordinal()],
                outOfRegion,
                invalid);
        log.info("zip.build.completed stats={}", stats);
        return new ZipCountyBuildResult(new ZipCountyMap(assigned, conflicts), resolutions, stats);
    }

    private String authoritativeChoice(int zip, List<String> counties) {
        for (String county : authoritativeTable.countiesFor(zip)) {
            if (counties.contains(county)) {
                return county;
            }
        }
        return null;
    }
}
