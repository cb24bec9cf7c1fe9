package com.participant.matching.metrics;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.zipcode.ZipResolution;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatch(MatchQuality quality, String county) {
    }

    @Override
    public void recordResolutionDuration(MatchQuality quality, Duration duration) {
    }

    @Override
    public void recordIndexSize(String index, int size) {
    }

    @Override
    public void incrementIndexCollision(String index, boolean crossCounty) {
    }

    @Override
    public void incrementZipResolution(ZipResolution resolution) {
    }
}
