package com.participant.matching.zipcode;

import com.participant.matching.metrics.MicrometerMetricsService;
import com.participant.matching.source.InMemoryReferenceDataSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ZipCountyMapBuilder Tests")
class ZipCountyMapBuilderTest {

    private static final AuthoritativeZipTable TABLE = AuthoritativeZipTable.fromClasspath();

    private final ZipCountyMapBuilder builder =
            new ZipCountyMapBuilder(TABLE, ZipRegion.OHIO, Set.of("AthensCounty"));

    @Nested
    @DisplayName("Conflict resolution")
    class ConflictTests {

        @Test
        @DisplayName("A single claimant should win outright")
        void singleClaimant() {
            ZipCountyBuildResult result = builder.build(Map.of("FranklinCounty", List.of(43065)));

            assertEquals("FranklinCounty", result.map().countyFor("43065").orElseThrow());
            assertEquals(ZipResolution.SINGLE_COUNTY, result.resolutionOf("43065"));
            assertTrue(result.map().multiCounty().isEmpty());
        }

        @Test
        @DisplayName("44903 claimed by Athens and Richland should go to Richland")
        void authoritativeOverride() {
            ZipCountyBuildResult result = builder.build(Map.of(
                    "AthensCounty", List.of(44903),
                    "RichlandCounty", List.of("44903")));

            assertEquals("RichlandCounty", result.map().countyFor("44903").orElseThrow());
            assertEquals(ZipResolution.AUTHORITATIVE_OVERRIDE, result.resolutionOf("44903"));
            assertEquals(List.of("AthensCounty", "RichlandCounty"), result.map().multiCounty().get("44903"));
        }

        @Test
        @DisplayName("Authoritative county must be one of the claimants")
        void authoritativeCountyNotClaiming() {
            ZipCountyBuildResult result = builder.build(Map.of(
                    "AthensCounty", List.of(44903),
                    "KnoxCounty", List.of(44903)));

            assertEquals("KnoxCounty", result.map().countyFor("44903").orElseThrow());
            assertEquals(ZipResolution.DENYLIST_FALLBACK, result.resolutionOf("44903"));
        }

        @Test
        @DisplayName("Overlapping ranges should favour the first listed claimant")
        void overlappingRanges() {
            ZipCountyBuildResult result = builder.build(Map.of(
                    "MorrowCounty", List.of(43314),
                    "MarionCounty", List.of(43314),
                    "KnoxCounty", List.of(43314)));

            assertEquals("MarionCounty", result.map().countyFor("43314").orElseThrow());
        }

        @Test
        @DisplayName("Without an authoritative range the denylist should decide")
        void denylistFallback() {
            ZipCountyBuildResult result = builder.build(Map.of(
                    "AthensCounty", List.of(44101),
                    "CuyahogaCounty", List.of(44101),
                    "LakeCounty", List.of(44101)));

            assertEquals("CuyahogaCounty", result.map().countyFor("44101").orElseThrow());
            assertEquals(ZipResolution.DENYLIST_FALLBACK, result.resolutionOf("44101"));
        }

        @Test
        @DisplayName("When every claimant is denylisted the first alphabetically should win")
        void alphabeticalFallback() {
            var strict = new ZipCountyMapBuilder(AuthoritativeZipTable.empty(), ZipRegion.OHIO,
                    Set.of("AthensCounty", "MeigsCounty"));

            ZipCountyBuildResult result = strict.build(Map.of(
                    "MeigsCounty", List.of(45771),
                    "AthensCounty", List.of(45771)));

            assertEquals("AthensCounty", result.map().countyFor("45771").orElseThrow());
            assertEquals(ZipResolution.ALPHABETICAL_FALLBACK, result.resolutionOf("45771"));
        }
    }

    @Test
    @DisplayName("Placeholders and out-of-region ZIPs should be excluded and counted")
    void filtersJunk() {
        ZipCountyBuildResult result = builder.build(Map.of(
                "FranklinCounty", List.of(43065, -1, Double.NaN, "n/a", 90210, "10001")));

        assertEquals(Set.of("43065"), result.map().zipcodeMap().keySet());
        assertEquals(3, result.stats().invalid());
        assertEquals(2, result.stats().outOfRegion());
    }

    @Test
    @DisplayName("Should build from a reference source and record metrics")
    void buildsFromSource() {
        var registry = new SimpleMeterRegistry();
        var source = new InMemoryReferenceDataSource()
                .add("FranklinCountyDemographic", Map.of("parcel_id", "1", "parcel_zip", 43065))
                .add("FranklinCountyResidential", Map.of("parcel_id", "1", "parcel_zip", 43065.0))
                .add("RichlandDemographic", Map.of("parcel_id", "2", "parcel_zip", "44903"))
                .add("AthensCountyResidential", Map.of("parcel_id", "3", "parcel_zip", 44903))
                .add("participants", Map.of("parcel_zip", 43302));
        var metered = new ZipCountyMapBuilder(TABLE, ZipRegion.OHIO, Set.of("AthensCounty"),
                new MicrometerMetricsService(registry));

        ZipCountyBuildResult result = metered.build(source);

        assertEquals(Map.of("43065", "FranklinCounty", "44903", "RichlandCounty"), result.map().zipcodeMap());
        assertEquals(4, result.stats().collectionsScanned());
        assertEquals(1, result.stats().authoritativeOverrides());
        assertEquals(1.0, registry.get("zipcode.resolution").tag("resolution", "authoritative_override")
                .counter().count());
    }
}
