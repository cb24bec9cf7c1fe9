package com.participant.matching.metrics;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.zipcode.ZipResolution;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordMatch(MatchQuality.EMAIL, "FranklinCounty");
                noOp.recordResolutionDuration(MatchQuality.PHONE, Duration.ofMillis(2));
                noOp.recordIndexSize("email", 10);
                noOp.incrementIndexCollision("phone", true);
                noOp.incrementZipResolution(ZipResolution.SINGLE_COUNTY);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count matches by quality and county")
        void recordMatch() {
            metrics.recordMatch(MatchQuality.EMAIL, "FranklinCounty");
            metrics.recordMatch(MatchQuality.EMAIL, "FranklinCounty");
            metrics.recordMatch(MatchQuality.NO_MATCH, "");

            assertEquals(2.0, registry.get("participant.match")
                    .tag("quality", "email").tag("county", "FranklinCounty").counter().count());
            assertEquals(1.0, registry.get("participant.match")
                    .tag("quality", "no_match").tag("county", "none").counter().count());
        }

        @Test
        @DisplayName("Should record resolution duration as timer")
        void recordResolutionDuration() {
            metrics.recordResolutionDuration(MatchQuality.ADDRESS, Duration.ofMillis(150));
            metrics.recordResolutionDuration(MatchQuality.ADDRESS, Duration.ofMillis(250));

            Timer timer = registry.find("participant.resolution.duration").tag("quality", "address").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Index size gauge should follow the latest value")
        void recordIndexSize() {
            metrics.recordIndexSize("email", 10);
            metrics.recordIndexSize("email", 12);

            assertEquals(12.0, registry.get("reference.index.size").tag("index", "email").gauge().value());
        }

        @Test
        @DisplayName("Should split collisions by scope")
        void collisions() {
            metrics.incrementIndexCollision("email", true);
            metrics.incrementIndexCollision("email", false);
            metrics.incrementIndexCollision("email", false);

            assertEquals(1.0, registry.get("reference.index.collision")
                    .tag("index", "email").tag("scope", "cross_county").counter().count());
            assertEquals(2.0, registry.get("reference.index.collision")
                    .tag("index", "email").tag("scope", "same_county").counter().count());
        }

        @Test
        @DisplayName("Should count ZIP resolutions by rule")
        void zipResolutions() {
            metrics.incrementZipResolution(ZipResolution.DENYLIST_FALLBACK);

            assertEquals(1.0, registry.get("zipcode.resolution")
                    .tag("resolution", "denylist_fallback").counter().count());
        }
    }
}
