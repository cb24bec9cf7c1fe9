package com.participant.matching.core.model;

import java.util.Objects;

/**
 * Join key between demographic and residential records. Parcel ids are only
 * unique inside one county, so the county is part of the key.
 */
public record ParcelKey(String county, String parcelId) {

    public ParcelKey {
        Objects.requireNonNull(county, "county is required");
        Objects.requireNonNull(parcelId, "parcelId is required");
    }

    @Override
    public String toString() {
        return county + "/" + parcelId;
    }
}
