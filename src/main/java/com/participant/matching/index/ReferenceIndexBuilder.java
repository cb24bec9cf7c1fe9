package com.participant.matching.index;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.ParcelKey;
import com.participant.matching.core.model.ResidentialRecord;
import com.participant.matching.metrics.MetricsService;
import com.participant.matching.metrics.NoOpMetricsService;
import com.participant.matching.rules.IdentityNormalizer;
import com.participant.matching.source.ReferenceCollection;
import com.participant.matching.source.ReferenceDataSource;
import com.participant.matching.source.ReferenceRecordMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Streams the reference collections once and fills the {@link ReferenceIndex} tables.
 *
 * <p>Counties are loaded alphabetically, demographic before residential. When two
 * records produce the same key the first one loaded keeps it; the later one is
 * counted as a collision and logged at debug level.</p>
 *
 * <p>Not thread-safe. Use one builder per build.</p>
 */
public class ReferenceIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(ReferenceIndexBuilder.class);

    static final String EMAIL_INDEX = "email";
    static final String PHONE_INDEX = "phone";
    static final String ADDRESS_INDEX = "address";
    static final String PARCEL_INDEX = "parcel";

    private final IdentityNormalizer normalizer;
    private final MetricsService metricsService;

    private final Map<String, DemographicRecord> byEmail = new HashMap<>();
    private final Map<String, DemographicRecord> byPhone = new HashMap<>();
    private final Map<String, ParcelKey> byAddress = new HashMap<>();
    private final Map<ParcelKey, DemographicRecord> demographics = new HashMap<>();
    private final Map<ParcelKey, ResidentialRecord> residentials = new HashMap<>();

    private int collectionsRead;
    private long documentsRead;
    private long demographicRecords;
    private long residentialRecords;
    private long skippedNoParcelId;
    private long sameCountyCollisions;
    private long crossCountyCollisions;

    public ReferenceIndexBuilder(IdentityNormalizer normalizer, MetricsService metricsService) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public ReferenceIndexBuilder(IdentityNormalizer normalizer) {
        this(normalizer, null);
    }

    /**
     * Loads every demographic and residential collection of the source.
     *
     * @throws com.participant.matching.source.ReferenceSourceException if the source fails mid-scan
     */
    public ReferenceIndexBuilder load(ReferenceDataSource source) {
        List<ReferenceCollection> collections = source.listCollections().stream()
                .map(ReferenceCollection::parse)
                .flatMap(Optional::stream)
                .sorted(ReferenceCollection.LOAD_ORDER)
                .toList();
        log.info("index.load.started source={} collections={}", source.getName(), collections.size());

        for (ReferenceCollection collection : collections) {
            long before = documentsRead;
            source.forEachDocument(collection.name(), document -> {
                documentsRead++;
                Optional<?> record = switch (collection.kind()) {
                    case DEMOGRAPHIC -> ReferenceRecordMapper.toDemographic(collection.county(), document)
                            .map(this::addDemographic);
                    case RESIDENTIAL -> ReferenceRecordMapper.toResidential(collection.county(), document)
                            .map(this::addResidential);
                };
                if (record.isEmpty()) {
                    skippedNoParcelId++;
                }
            });
            collectionsRead++;
            log.debug("index.load.collection collection={} county={} documents={}",
                    collection.name(), collection.county(), documentsRead - before);
        }
        return this;
    }

    /**
     * Adds one demographic record under its email, phone, address and parcel keys.
     */
    public DemographicRecord addDemographic(DemographicRecord record) {
        demographicRecords++;
        ParcelKey parcelKey = record.parcelKey();
        putFirst(demographics, parcelKey, record, PARCEL_INDEX, record.county(), DemographicRecord::county);
        putFirst(byEmail, normalizer.normalizeEmail(record.email()), record, EMAIL_INDEX,
                record.county(), DemographicRecord::county);
        putFirst(byPhone, normalizer.normalizePhone(record.mobile()), record, PHONE_INDEX,
                record.county(), DemographicRecord::county);
        putAddress(normalizer.normalizeAddress(record.address(), record.parcelZip()), parcelKey);
        return record;
    }

    /**
     * Adds one residential record under its parcel and address keys.
     */
    public ResidentialRecord addResidential(ResidentialRecord record) {
        residentialRecords++;
        ParcelKey parcelKey = record.parcelKey();
        putFirst(residentials, parcelKey, record, PARCEL_INDEX, record.county(), ResidentialRecord::county);
        putAddress(normalizer.normalizeAddress(record.address(), record.parcelZip()), parcelKey);
        return record;
    }

    /**
     * Freezes the tables into an immutable index.
     */
    public ReferenceIndex build() {
        var stats = new IndexBuildStats(collectionsRead, documentsRead, demographicRecords, residentialRecords,
                skippedNoParcelId, sameCountyCollisions, crossCountyCollisions);
        var index = new ReferenceIndex(byEmail, byPhone, byAddress, demographics, residentials, stats);

        metricsService.recordIndexSize(EMAIL_INDEX, index.emailCount());
        metricsService.recordIndexSize(PHONE_INDEX, index.phoneCount());
        metricsService.recordIndexSize(ADDRESS_INDEX, index.addressCount());
        metricsService.recordIndexSize(PARCEL_INDEX, index.demographicCount() + index.residentialCount());

        if (stats.totalCollisions() > 0) {
            log.warn("index.collisions sameCounty={} crossCounty={} policy=first-loaded-wins",
                    sameCountyCollisions, crossCountyCollisions);
        }
        if (skippedNoParcelId > 0) {
            log.warn("index.skipped documentsWithoutParcelId={}", skippedNoParcelId);
        }
        log.info("index.build.completed index={} stats={}", index, stats);
        return index;
    }

    private <V> void putFirst(Map<String, V> table, String key, V value, String indexName,
                              String county, Function<V, String> countyOf) {
        if (key == null) {
            return;
        }
        V existing = table.putIfAbsent(key, value);
        if (existing != null) {
            recordCollision(indexName, key, countyOf.apply(existing), county);
        }
    }

    private <V> void putFirst(Map<ParcelKey, V> table, ParcelKey key, V value, String indexName,
                              String county, Function<V, String> countyOf) {
        V existing = table.putIfAbsent(key, value);
        if (existing != null) {
            recordCollision(indexName, key.toString(), countyOf.apply(existing), county);
        }
    }

    private void putAddress(String addressKey, ParcelKey parcelKey) {
        if (addressKey == null) {
            return;
        }
        ParcelKey existing = byAddress.putIfAbsent(addressKey, parcelKey);
        // demographic and residential rows of one parcel share its address
        if (existing != null && !existing.equals(parcelKey)) {
            recordCollision(ADDRESS_INDEX, addressKey, existing.county(), parcelKey.county());
        }
    }

    private void recordCollision(String indexName, String key, String keptCounty, String droppedCounty) {
        boolean crossCounty = !keptCounty.equals(droppedCounty);
        if (crossCounty) {
            crossCountyCollisions++;
        } else {
            sameCountyCollisions++;
        }
        metricsService.incrementIndexCollision(indexName, crossCounty);
        log.debug("index.collision index={} key={} keptCounty={} droppedCounty={}",
                indexName, key, keptCounty, droppedCounty);
    }
}
