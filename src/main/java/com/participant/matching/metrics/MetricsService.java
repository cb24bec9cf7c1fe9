package com.participant.matching.metrics;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.zipcode.ZipResolution;

import java.time.Duration;

/**
 * Interface for recording matching run metrics.
 * The default {@link NoOpMetricsService} does nothing, so a run needs no metrics
 * backend to be configured.
 */
public interface MetricsService {

    void recordMatch(MatchQuality quality, String county);

    void recordResolutionDuration(MatchQuality quality, Duration duration);

    /**
     * @param index the index name, for example {@code email}
     * @param size  number of keys held by the index
     */
    void recordIndexSize(String index, int size);

    void incrementIndexCollision(String index, boolean crossCounty);

    void incrementZipResolution(ZipResolution resolution);
}
