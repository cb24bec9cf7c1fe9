package com.participant.matching.job;

import com.participant.matching.bulk.ExportResult;
import com.participant.matching.bulk.ParticipantReadResult;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.index.IndexBuildStats;
import com.participant.matching.report.MatchStatistics;

import java.time.Duration;
import java.util.List;

/**
 * Everything a finished run produced.
 *
 * @param runId          id the run logged under
 * @param zipCodes       ZIPs known to the ZIP to county map
 * @param indexStats     reference index build counters
 * @param readResult     participants read from the input
 * @param results        one result per participant, in input order
 * @param statistics     aggregated results
 * @param matchedExport  matched CSV export, null when no output directory was given
 * @param debugExport    unmatched debug CSV export, null when no output directory was given
 * @param duration       wall-clock duration of the run
 */
public record MatchRunResult(
        String runId,
        int zipCodes,
        IndexBuildStats indexStats,
        ParticipantReadResult readResult,
        List<MatchResult> results,
        MatchStatistics statistics,
        ExportResult matchedExport,
        ExportResult debugExport,
        Duration duration
) {
    public MatchRunResult {
        results = results != null ? List.copyOf(results) : List.of();
    }

    @Override
    public String toString() {
        return "MatchRunResult{runId=" + runId +
                ", zipCodes=" + zipCodes +
                ", participants=" + results.size() +
                ", matched=" + statistics.getMatched() +
                ", matchedExport=" + matchedExport +
                ", debugExport=" + debugExport +
                ", duration=" + duration + '}';
    }
}
