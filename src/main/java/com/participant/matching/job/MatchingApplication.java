package com.participant.matching.job;

import com.participant.matching.config.MatchingConfig;
import com.participant.matching.metrics.MicrometerMetricsService;
import com.participant.matching.rules.IdentityNormalizer;
import com.participant.matching.source.JsonLinesReferenceDataSource;
import com.participant.matching.source.MongoReferenceDataSource;
import com.participant.matching.source.ReferenceDataSource;
import com.participant.matching.source.ReferenceSourceException;
import com.participant.matching.zipcode.ZipCacheException;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar participant-matching.jar &lt;participants.csv&gt; [outputDir]
 * </pre>
 *
 * Exit codes: 0 success, 1 reference store or I/O failure, 2 usage error.
 */
public final class MatchingApplication {
    private static final Logger log = LoggerFactory.getLogger(MatchingApplication.class);

    private MatchingApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: participant-matching <participants.csv> [outputDir]");
            return 2;
        }
        Path participants = Path.of(args[0]);
        Path outputDir = args.length == 2 ? Path.of(args[1]) : null;

        MatchingConfig config;
        try {
            config = MatchingConfig.load();
        } catch (IllegalArgumentException e) {
            log.error("config.invalid error={}", e.getMessage());
            return 2;
        }

        var registry = new SimpleMeterRegistry();
        try (ReferenceDataSource source = openSource(config)) {
            var job = new MatchingJob(config, source, IdentityNormalizer.defaults(),
                    new MicrometerMetricsService(registry), null);
            job.run(participants, outputDir);
            logMeters(registry);
            return 0;
        } catch (ReferenceSourceException | ZipCacheException e) {
            log.error("run.failed error={}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.error("run.failed io error={}", e.getMessage(), e);
            return 1;
        }
    }

    static ReferenceDataSource openSource(MatchingConfig config) {
        if (config.getJsonlDirectory() != null) {
            return new JsonLinesReferenceDataSource(config.getJsonlDirectory());
        }
        return MongoReferenceDataSource.connect(config.getMongoUri(), config.getMongoDatabase());
    }

    private static void logMeters(SimpleMeterRegistry registry) {
        for (Meter meter : registry.getMeters()) {
            meter.measure().forEach(measurement -> log.debug("metric name={} tags={} {}={}",
                    meter.getId().getName(), meter.getId().getTags(),
                    measurement.getStatistic(), measurement.getValue()));
        }
    }
}
