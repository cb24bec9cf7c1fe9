package com.participant.matching.core.model;

import java.util.Objects;

/**
 * A demographic reference row for one parcel, harvested from a county collection.
 * Optional fields are {@code null} when the source carried a placeholder
 * ({@code -1}, {@code NaN}) or nothing at all.
 *
 * @param county            source county, e.g. {@code FranklinCounty}
 * @param parcelId          parcel identifier, unique within the county
 * @param email             raw email the record was harvested with
 * @param mobile            raw phone the record was harvested with
 * @param address           raw street address of the parcel
 * @param parcelZip         raw parcel ZIP as found in the source
 * @param customerName      derived customer name
 * @param estimatedIncome   estimated household income
 * @param totalEnergyBurden total energy burden ratio
 * @param age               age of the first individual, in two-year increments
 */
public record DemographicRecord(
        String county,
        String parcelId,
        String email,
        String mobile,
        String address,
        String parcelZip,
        String customerName,
        Double estimatedIncome,
        Double totalEnergyBurden,
        Integer age
) {
    public DemographicRecord {
        Objects.requireNonNull(county, "county is required");
        Objects.requireNonNull(parcelId, "parcelId is required");
    }

    public ParcelKey parcelKey() {
        return new ParcelKey(county, parcelId);
    }
}
