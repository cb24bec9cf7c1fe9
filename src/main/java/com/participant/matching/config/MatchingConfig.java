package com.participant.matching.config;

import com.participant.matching.zipcode.ZipRegion;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings for a matching run.
 *
 * <p>Either {@code mongoUri} or {@code jsonlDirectory} names the reference store;
 * the JSON-lines directory wins when both are set.</p>
 *
 * <p>Read through MicroProfile Config. Property keys, all prefixed {@code matching.}:</p>
 * <ul>
 *   <li>{@code mongo.uri}, {@code mongo.database}</li>
 *   <li>{@code jsonl.directory}</li>
 *   <li>{@code zip.cache}, {@code zip.region.min}, {@code zip.region.max},
 *       {@code zip.denylist} (comma-separated), {@code zip.authoritative}</li>
 *   <li>{@code parallel}, {@code engaged-only}, {@code debug.limit}, {@code report.sample-size}</li>
 * </ul>
 * <p>The environment source follows the MicroProfile mapping, so {@code matching.zip.region.min}
 * can be set as {@code MATCHING_ZIP_REGION_MIN}.</p>
 */
public class MatchingConfig {
    private static final Logger log = LoggerFactory.getLogger(MatchingConfig.class);

    public static final String MONGO_URI = "matching.mongo.uri";
    public static final String MONGO_DATABASE = "matching.mongo.database";
    public static final String JSONL_DIRECTORY = "matching.jsonl.directory";
    public static final String ZIP_CACHE = "matching.zip.cache";
    public static final String ZIP_REGION_MIN = "matching.zip.region.min";
    public static final String ZIP_REGION_MAX = "matching.zip.region.max";
    public static final String ZIP_DENYLIST = "matching.zip.denylist";
    public static final String ZIP_AUTHORITATIVE = "matching.zip.authoritative";
    public static final String PARALLEL = "matching.parallel";
    public static final String ENGAGED_ONLY = "matching.engaged-only";
    public static final String DEBUG_LIMIT = "matching.debug.limit";
    public static final String REPORT_SAMPLE_SIZE = "matching.report.sample-size";

    private final String mongoUri;
    private final String mongoDatabase;
    private final Path jsonlDirectory;
    private final Path zipCachePath;
    private final ZipRegion zipRegion;
    private final Set<String> countyDenylist;
    private final Path authoritativeTablePath;
    private final boolean parallel;
    private final boolean engagedOnly;
    private final int debugExportLimit;
    private final int failureSampleSize;

    private MatchingConfig(Builder builder) {
        this.mongoUri = builder.mongoUri;
        this.mongoDatabase = builder.mongoDatabase;
        this.jsonlDirectory = builder.jsonlDirectory;
        this.zipCachePath = builder.zipCachePath;
        this.zipRegion = new ZipRegion(builder.zipRegionMin, builder.zipRegionMax);
        this.countyDenylist = Set.copyOf(builder.countyDenylist);
        this.authoritativeTablePath = builder.authoritativeTablePath;
        this.parallel = builder.parallel;
        this.engagedOnly = builder.engagedOnly;
        this.debugExportLimit = builder.debugExportLimit;
        this.failureSampleSize = builder.failureSampleSize;
    }

    public String getMongoUri() { return mongoUri; }
    public String getMongoDatabase() { return mongoDatabase; }
    public Path getJsonlDirectory() { return jsonlDirectory; }
    public Path getZipCachePath() { return zipCachePath; }
    public ZipRegion getZipRegion() { return zipRegion; }
    public Set<String> getCountyDenylist() { return countyDenylist; }
    public Path getAuthoritativeTablePath() { return authoritativeTablePath; }
    public boolean isParallel() { return parallel; }
    public boolean isEngagedOnly() { return engagedOnly; }
    public int getDebugExportLimit() { return debugExportLimit; }
    public int getFailureSampleSize() { return failureSampleSize; }

    public static MatchingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the default MicroProfile Config sources: system properties, environment
     * variables and {@code META-INF/microprofile-config.properties}.
     *
     * @throws IllegalArgumentException if a value cannot be converted or fails validation
     */
    public static MatchingConfig load() {
        Config config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredConverters()
                .build();
        MatchingConfig matchingConfig = fromConfig(config);
        log.info("config.loaded config={}", matchingConfig);
        return matchingConfig;
    }

    /**
     * Builds a config from {@code matching.}-prefixed properties. Absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be converted
     */
    public static MatchingConfig fromConfig(Config config) {
        Builder builder = builder();
        string(config, MONGO_URI).ifPresent(builder::mongoUri);
        string(config, MONGO_DATABASE).ifPresent(builder::mongoDatabase);
        string(config, JSONL_DIRECTORY).map(Path::of).ifPresent(builder::jsonlDirectory);
        string(config, ZIP_CACHE).map(Path::of).ifPresent(builder::zipCachePath);
        config.getOptionalValue(ZIP_REGION_MIN, Integer.class).ifPresent(builder::zipRegionMin);
        config.getOptionalValue(ZIP_REGION_MAX, Integer.class).ifPresent(builder::zipRegionMax);
        config.getOptionalValues(ZIP_DENYLIST, String.class)
                .map(values -> values.stream().map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.toSet()))
                .ifPresent(builder::countyDenylist);
        string(config, ZIP_AUTHORITATIVE).map(Path::of).ifPresent(builder::authoritativeTablePath);
        config.getOptionalValue(PARALLEL, Boolean.class).ifPresent(builder::parallel);
        config.getOptionalValue(ENGAGED_ONLY, Boolean.class).ifPresent(builder::engagedOnly);
        config.getOptionalValue(DEBUG_LIMIT, Integer.class).ifPresent(builder::debugExportLimit);
        config.getOptionalValue(REPORT_SAMPLE_SIZE, Integer.class).ifPresent(builder::failureSampleSize);
        return builder.build();
    }

    private static Optional<String> string(Config config, String key) {
        return config.getOptionalValue(key, String.class).map(String::trim);
    }

    public static class Builder {
        private String mongoUri = "mongodb://localhost:27017";
        private String mongoDatabase = "empower_development";
        private Path jsonlDirectory;
        private Path zipCachePath = Path.of("data", "zipcode_to_county_cache.json");
        private int zipRegionMin = ZipRegion.OHIO.min();
        private int zipRegionMax = ZipRegion.OHIO.max();
        private Set<String> countyDenylist = Set.of("AthensCounty");
        private Path authoritativeTablePath;
        private boolean parallel = false;
        private boolean engagedOnly = false;
        private int debugExportLimit = 50;
        private int failureSampleSize = 10;

        public Builder mongoUri(String mongoUri) {
            this.mongoUri = mongoUri;
            return this;
        }

        public Builder mongoDatabase(String mongoDatabase) {
            if (mongoDatabase == null || mongoDatabase.isBlank()) {
                throw new IllegalArgumentException("mongoDatabase must not be blank");
            }
            this.mongoDatabase = mongoDatabase;
            return this;
        }

        public Builder jsonlDirectory(Path jsonlDirectory) {
            this.jsonlDirectory = jsonlDirectory;
            return this;
        }

        public Builder zipCachePath(Path zipCachePath) {
            if (zipCachePath == null) throw new IllegalArgumentException("zipCachePath is required");
            this.zipCachePath = zipCachePath;
            return this;
        }

        public Builder zipRegionMin(int zipRegionMin) {
            this.zipRegionMin = zipRegionMin;
            return this;
        }

        public Builder zipRegionMax(int zipRegionMax) {
            this.zipRegionMax = zipRegionMax;
            return this;
        }

        public Builder countyDenylist(Set<String> countyDenylist) {
            this.countyDenylist = countyDenylist != null ? countyDenylist : Set.of();
            return this;
        }

        public Builder authoritativeTablePath(Path authoritativeTablePath) {
            this.authoritativeTablePath = authoritativeTablePath;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder engagedOnly(boolean engagedOnly) {
            this.engagedOnly = engagedOnly;
            return this;
        }

        public Builder debugExportLimit(int debugExportLimit) {
            if (debugExportLimit < 0) throw new IllegalArgumentException("debugExportLimit must be >= 0");
            this.debugExportLimit = debugExportLimit;
            return this;
        }

        public Builder failureSampleSize(int failureSampleSize) {
            if (failureSampleSize < 0) throw new IllegalArgumentException("failureSampleSize must be >= 0");
            this.failureSampleSize = failureSampleSize;
            return this;
        }

        public MatchingConfig build() {
            if (jsonlDirectory == null && (mongoUri == null || mongoUri.isBlank())) {
                throw new IllegalArgumentException("Either mongoUri or jsonlDirectory is required");
            }
            if (zipRegionMin > zipRegionMax) {
                throw new IllegalArgumentException("zipRegionMin cannot exceed zipRegionMax");
            }
            return new MatchingConfig(this);
        }
    }

    @Override
    public String toString() {
        return "MatchingConfig{" +
                "mongoDatabase='" + mongoDatabase + '\'' +
                ", jsonlDirectory=" + jsonlDirectory +
                ", zipCachePath=" + zipCachePath +
                ", zipRegion=" + zipRegion.min() + ".." + zipRegion.max() +
                ", countyDenylist=" + countyDenylist +
                ", authoritativeTablePath=" + authoritativeTablePath +
                ", parallel=" + parallel +
                ", engagedOnly=" + engagedOnly +
                ", debugExportLimit=" + debugExportLimit +
                ", failureSampleSize=" + failureSampleSize +
                '}';
    }
}
