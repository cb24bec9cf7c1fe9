package com.participant.matching.report;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.rules.IdentityNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates the results of a run: counts by quality, method and county, plus a bounded
 * sample of unmatched participants for debugging.
 *
 * <p>Not thread-safe; feed it from one thread.</p>
 */
public class MatchStatistics {

    public static final int DEFAULT_SAMPLE_SIZE = 10;
    private static final IdentityNormalizer ZIP_NORMALIZER = IdentityNormalizer.defaults();

    private final int sampleSize;
    private final Map<MatchQuality, Long> byQuality = new EnumMap<>(MatchQuality.class);
    private final Map<String, Long> byMethod = new TreeMap<>();
    private final Map<String, CountyCount> byCounty = new TreeMap<>();
    private final List<MatchResult> unmatchedSample = new ArrayList<>();
    private long total;
    private long withZip;

    public MatchStatistics(int sampleSize) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must not be negative");
        }
        this.sampleSize = sampleSize;
        for (MatchQuality quality : MatchQuality.values()) {
            byQuality.put(quality, 0L);
        }
    }

    public MatchStatistics() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    public static MatchStatistics of(List<MatchResult> results, int sampleSize) {
        MatchStatistics statistics = new MatchStatistics(sampleSize);
        results.forEach(statistics::record);
        return statistics;
    }

    public void record(MatchResult result) {
        total++;
        byQuality.merge(result.matchQuality(), 1L, Long::sum);
        byMethod.merge(result.matchMethod(), 1L, Long::sum);
        if (ZIP_NORMALIZER.normalizeZip(result.participant().getZip()) != null) {
            withZip++;
        }
        if (result.hasCounty()) {
            byCounty.computeIfAbsent(result.countyName(), k -> new CountyCount())
                    .add(result.isMatched());
        }
        if (!result.isMatched() && unmatchedSample.size() < sampleSize) {
            unmatchedSample.add(result);
        }
    }

    public long getTotal() {
        return total;
    }

    public long getMatched() {
        return total - count(MatchQuality.NO_MATCH);
    }

    public long count(MatchQuality quality) {
        return byQuality.get(quality);
    }

    /**
     * Share of participants matched, between 0 and 1. Zero for an empty run.
     */
    public double matchRate() {
        return total == 0 ? 0.0 : (double) getMatched() / total;
    }

    public long getWithZip() {
        return withZip;
    }

    public long getWithoutZip() {
        return total - withZip;
    }

    public Map<MatchQuality, Long> getByQuality() {
        return Collections.unmodifiableMap(byQuality);
    }

    public Map<String, Long> getByMethod() {
        return Collections.unmodifiableMap(byMethod);
    }

    /**
     * Per-county totals and matched counts, only for results carrying a county.
     */
    public Map<String, CountySummary> getByCounty() {
        Map<String, CountySummary> summaries = new TreeMap<>();
        byCounty.forEach((county, count) -> summaries.put(county, new CountySummary(count.total, count.matched)));
        return Collections.unmodifiableMap(summaries);
    }

    public List<MatchResult> getUnmatchedSample() {
        return Collections.unmodifiableList(unmatchedSample);
    }

    /**
     * @param total   participants attributed to the county
     * @param matched of those, participants matched to a reference record
     */
    public record CountySummary(long total, long matched) {}

    private static final class CountyCount {
        private long total;
        private long matched;

        void add(boolean isMatched) {
            total++;
            if (isMatched) {
                matched++;
            }
        }
    }
}
