package com.participant.matching.job;

import com.participant.matching.bulk.CsvMatchExporter;
import com.participant.matching.bulk.CsvParticipantReader;
import com.participant.matching.bulk.ExportResult;
import com.participant.matching.bulk.ParticipantReadResult;
import com.participant.matching.bulk.ProgressCallback;
import com.participant.matching.config.MatchingConfig;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.index.ReferenceIndex;
import com.participant.matching.index.ReferenceIndexBuilder;
import com.participant.matching.logging.LogContext;
import com.participant.matching.matching.MatchResolver;
import com.participant.matching.metrics.MetricsService;
import com.participant.matching.metrics.NoOpMetricsService;
import com.participant.matching.report.MatchReport;
import com.participant.matching.report.MatchStatistics;
import com.participant.matching.rules.IdentityNormalizer;
import com.participant.matching.source.ReferenceDataSource;
import com.participant.matching.source.ReferenceSourceException;
import com.participant.matching.zipcode.AuthoritativeZipTable;
import com.participant.matching.zipcode.ZipCountyCache;
import com.participant.matching.zipcode.ZipCountyMap;
import com.participant.matching.zipcode.ZipCountyMapBuilder;
import com.participant.matching.zipcode.ZipCountyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One end-to-end matching run: ZIP map, reference index, participants, resolution,
 * statistics and exports.
 *
 * <p>The reference store is checked before any work starts; a store that is not
 * reachable, or that fails while the index is built, aborts the run with
 * {@link ReferenceSourceException} instead of producing results from partial data.</p>
 */
public class MatchingJob {
    private static final Logger log = LoggerFactory.getLogger(MatchingJob.class);

    public static final String MATCHED_EXPORT_FILE = "matched_participants.csv";
    public static final String DEBUG_EXPORT_FILE = "unmatched_debug.csv";

    private final MatchingConfig config;
    private final ReferenceDataSource source;
    private final IdentityNormalizer normalizer;
    private final MetricsService metricsService;
    private final ProgressCallback progressCallback;

    public MatchingJob(MatchingConfig config, ReferenceDataSource source, IdentityNormalizer normalizer,
                       MetricsService metricsService, ProgressCallback progressCallback) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.normalizer = normalizer != null ? normalizer : IdentityNormalizer.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.progressCallback = progressCallback != null ? progressCallback : ProgressCallback.NOOP;
    }

    public MatchingJob(MatchingConfig config, ReferenceDataSource source) {
        this(config, source, null, null, null);
    }

    /**
     * Runs the job.
     *
     * @param participantsCsv participant CSV to match
     * @param outputDir       directory for the CSV exports, or null to skip exporting
     * @throws IOException              if the participant file cannot be read or an export cannot be written
     * @throws ReferenceSourceException if the reference store is unreachable or fails
     */
    public MatchRunResult run(Path participantsCsv, Path outputDir) throws IOException {
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("run.started source={} participants={} outputDir={}", source.getName(), participantsCsv, outputDir);
            if (!source.isConnected()) {
                throw new ReferenceSourceException("Reference store " + source.getName() + " is not reachable");
            }

            ZipCountyMap zipMap = loadZipMap();
            ZipCountyResolver zipResolver = new ZipCountyResolver(zipMap, normalizer);

            ReferenceIndex index = new ReferenceIndexBuilder(normalizer, metricsService).load(source).build();

            ParticipantReadResult readResult = new CsvParticipantReader(config.isEngagedOnly())
                    .read(participantsCsv, progressCallback);

            MatchResolver resolver = MatchResolver.withDefaultStrategies(index, zipResolver, normalizer, metricsService);
            List<MatchResult> results = resolver.resolveAll(readResult.participants(), config.isParallel());

            MatchStatistics statistics = MatchStatistics.of(results, config.getFailureSampleSize());
            new MatchReport(statistics).log();

            ExportResult matchedExport = null;
            ExportResult debugExport = null;
            if (outputDir != null) {
                Files.createDirectories(outputDir);
                var exporter = new CsvMatchExporter();
                matchedExport = exporter.exportMatched(outputDir.resolve(MATCHED_EXPORT_FILE), results, progressCallback);
                debugExport = exporter.exportUnmatchedDebug(outputDir.resolve(DEBUG_EXPORT_FILE), results,
                        config.getDebugExportLimit());
            }

            var runResult = new MatchRunResult(runId, zipMap.size(), index.getStats(), readResult, results,
                    statistics, matchedExport, debugExport, Duration.ofNanos(System.nanoTime() - start));
            log.info("run.completed result={}", runResult);
            return runResult;
        }
    }

    private ZipCountyMap loadZipMap() {
        AuthoritativeZipTable table = config.getAuthoritativeTablePath() != null
                ? AuthoritativeZipTable.fromPath(config.getAuthoritativeTablePath())
                : AuthoritativeZipTable.fromClasspath();
        var builder = new ZipCountyMapBuilder(table, config.getZipRegion(), config.getCountyDenylist(), metricsService);
        return new ZipCountyCache(config.getZipCachePath()).loadOrRebuild(() -> builder.build(source).map());
    }
}
