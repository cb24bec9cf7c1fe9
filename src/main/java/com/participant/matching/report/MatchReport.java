package com.participant.matching.report;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders {@link MatchStatistics} as human-readable report lines.
 */
public class MatchReport {
    private static final Logger log = LoggerFactory.getLogger(MatchReport.class);

    public static final int DEFAULT_TOP_COUNTIES = 10;

    private final MatchStatistics statistics;
    private final int topCounties;

    public MatchReport(MatchStatistics statistics, int topCounties) {
        this.statistics = statistics;
        this.topCounties = topCounties;
    }

    public MatchReport(MatchStatistics statistics) {
        this(statistics, DEFAULT_TOP_COUNTIES);
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "Participants: %d (with ZIP: %d, without ZIP: %d)",
                statistics.getTotal(), statistics.getWithZip(), statistics.getWithoutZip()));
        lines.add(String.format(Locale.ROOT, "Matched: %d (%.1f%%)",
                statistics.getMatched(), statistics.matchRate() * 100));
        for (MatchQuality quality : MatchQuality.values()) {
            lines.add(String.format(Locale.ROOT, "  %-8s %d", quality.getLabel(), statistics.count(quality)));
        }
        lines.add("Methods:");
        statistics.getByMethod().forEach((method, count) ->
                lines.add(String.format(Locale.ROOT, "  %-15s %d", method, count)));
        lines.add("Top counties:");
        statistics.getByCounty().entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, MatchStatistics.CountySummary> e) -> e.getValue().total())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(topCounties)
                .forEach(e -> lines.add(String.format(Locale.ROOT, "  %-20s %d participants, %d matched",
                        e.getKey(), e.getValue().total(), e.getValue().matched())));
        if (!statistics.getUnmatchedSample().isEmpty()) {
            lines.add("Unmatched sample:");
            for (MatchResult result : statistics.getUnmatchedSample()) {
                var p = result.participant();
                lines.add(String.format(Locale.ROOT, "  id=%s zip=%s method=%s county=%s",
                        p.getParticipantId(), p.getZip(), result.matchMethod(),
                        result.hasCounty() ? result.countyName() : "-"));
            }
        }
        return lines;
    }

    /**
     * Writes the report to the log at info level.
     */
    public void log() {
        lines().forEach(line -> log.info("report {}", line));
    }
}
