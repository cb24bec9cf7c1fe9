package com.participant.matching.metrics;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.zipcode.ZipResolution;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code participant.match} Counter (tags: quality, county)</li>
 *   <li>{@code participant.resolution.duration} Timer (tag: quality)</li>
 *   <li>{@code reference.index.size} Gauge (tag: index)</li>
 *   <li>{@code reference.index.collision} Counter (tags: index, scope)</li>
 *   <li>{@code zipcode.resolution} Counter (tag: resolution)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private static final String NO_COUNTY = "none";

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> indexSizes = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordMatch(MatchQuality quality, String county) {
        String countyTag = county == null || county.isEmpty() ? NO_COUNTY : county;
        String key = "match:" + quality.name() + ":" + countyTag;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("participant.match")
                        .description("Participants resolved, by match quality and county")
                        .tag("quality", quality.getLabel())
                        .tag("county", countyTag)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordResolutionDuration(MatchQuality quality, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(quality.name(), k ->
                Timer.builder("participant.resolution.duration")
                        .description("Duration of a single participant resolution")
                        .tag("quality", quality.getLabel())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordIndexSize(String index, int size) {
        indexSizes.computeIfAbsent(index, k -> registry.gauge(
                "reference.index.size",
                Tags.of("index", k),
                new AtomicInteger())).set(size);
    }

    @Override
    public void incrementIndexCollision(String index, boolean crossCounty) {
        String scope = crossCounty ? "cross_county" : "same_county";
        Counter counter = counterCache.computeIfAbsent("collision:" + index + ":" + scope, k ->
                Counter.builder("reference.index.collision")
                        .description("Index keys already held by an earlier record")
                        .tag("index", index)
                        .tag("scope", scope)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementZipResolution(ZipResolution resolution) {
        Counter counter = counterCache.computeIfAbsent("zip:" + resolution.name(), k ->
                Counter.builder("zipcode.resolution")
                        .description("ZIP codes assigned to a county, by conflict rule")
                        .tag("resolution", resolution.name().toLowerCase(Locale.ROOT))
                        .register(registry));
        counter.increment();
    }
}
