package com.participant.matching.core.model;

import java.util.Objects;

/**
 * A residential property row for one parcel. Linked to {@link DemographicRecord}
 * through the shared {@link ParcelKey}.
 *
 * @param county    source county
 * @param parcelId  parcel identifier, unique within the county
 * @param address   raw street address
 * @param parcelZip raw parcel ZIP
 * @param yearBuilt year the structure was built (the source calls this field {@code age})
 */
public record ResidentialRecord(
        String county,
        String parcelId,
        String address,
        String parcelZip,
        Integer yearBuilt
) {
    public ResidentialRecord {
        Objects.requireNonNull(county, "county is required");
        Objects.requireNonNull(parcelId, "parcelId is required");
    }

    public ParcelKey parcelKey() {
        return new ParcelKey(county, parcelId);
    }
}
