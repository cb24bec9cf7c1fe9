package com.participant.matching.index;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.ParcelKey;
import com.participant.matching.core.model.ResidentialRecord;

import java.util.Map;
import java.util.Optional;

/**
 * In-memory lookup tables over the reference data, keyed by normalized identifiers.
 *
 * <p>Built once per run by {@link ReferenceIndexBuilder} and never modified afterwards,
 * so it can be shared by concurrent resolvers. Keys must already be normalized with
 * {@link com.participant.matching.rules.IdentityNormalizer}.</p>
 */
public final class ReferenceIndex {

    private final Map<String, DemographicRecord> byEmail;
    private final Map<String, DemographicRecord> byPhone;
    private final Map<String, ParcelKey> byAddress;
    private final Map<ParcelKey, DemographicRecord> demographics;
    private final Map<ParcelKey, ResidentialRecord> residentials;
    private final IndexBuildStats stats;

    ReferenceIndex(Map<String, DemographicRecord> byEmail,
                   Map<String, DemographicRecord> byPhone,
                   Map<String, ParcelKey> byAddress,
                   Map<ParcelKey, DemographicRecord> demographics,
                   Map<ParcelKey, ResidentialRecord> residentials,
                   IndexBuildStats stats) {
        this.byEmail = Map.copyOf(byEmail);
        this.byPhone = Map.copyOf(byPhone);
        this.byAddress = Map.copyOf(byAddress);
        this.demographics = Map.copyOf(demographics);
        this.residentials = Map.copyOf(residentials);
        this.stats = stats;
    }

    public static ReferenceIndex empty() {
        return new ReferenceIndex(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), IndexBuildStats.empty());
    }

    public Optional<DemographicRecord> lookupByEmail(String normalizedEmail) {
        return normalizedEmail == null ? Optional.empty() : Optional.ofNullable(byEmail.get(normalizedEmail));
    }

    public Optional<DemographicRecord> lookupByPhone(String normalizedPhone) {
        return normalizedPhone == null ? Optional.empty() : Optional.ofNullable(byPhone.get(normalizedPhone));
    }

    public Optional<ParcelKey> lookupByAddress(String addressKey) {
        return addressKey == null ? Optional.empty() : Optional.ofNullable(byAddress.get(addressKey));
    }

    public Optional<DemographicRecord> findDemographic(ParcelKey parcelKey) {
        return Optional.ofNullable(demographics.get(parcelKey));
    }

    public Optional<ResidentialRecord> findResidential(ParcelKey parcelKey) {
        return Optional.ofNullable(residentials.get(parcelKey));
    }

    public int emailCount() {
        return byEmail.size();
    }

    public int phoneCount() {
        return byPhone.size();
    }

    public int addressCount() {
        return byAddress.size();
    }

    public int demographicCount() {
        return demographics.size();
    }

    public int residentialCount() {
        return residentials.size();
    }

    public IndexBuildStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "ReferenceIndex{emails=" + byEmail.size() +
                ", phones=" + byPhone.size() +
                ", addresses=" + byAddress.size() +
                ", demographics=" + demographics.size() +
                ", residentials=" + residentials.size() + '}';
    }
}
