package com.participant.matching.source;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.ResidentialRecord;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Converts raw reference documents into typed records.
 *
 * <p>Source documents are loosely typed: phones and parcel ids arrive as numbers or strings,
 * and missing values are written as {@code -1}, {@code NaN} or empty strings. All of these
 * placeholders become {@code null} here so nothing downstream has to know about them.</p>
 */
public final class ReferenceRecordMapper {

    public static final String FIELD_PARCEL_ID = "parcel_id";
    public static final String FIELD_PARCEL_ZIP = "parcel_zip";
    public static final String FIELD_ADDRESS = "address";
    public static final String FIELD_EMAIL = "email";
    public static final String FIELD_MOBILE = "mobile";
    public static final String FIELD_PHONE = "phone";
    public static final String FIELD_CUSTOMER_NAME = "customer_name";
    public static final String FIELD_ESTIMATED_INCOME = "estimated_income";
    public static final String FIELD_TOTAL_ENERGY_BURDEN = "total_energy_burden";
    public static final String FIELD_DEMOGRAPHIC_AGE = "age in two-year increments - 1st individual";
    public static final String FIELD_YEAR_BUILT = "age";

    private static final double MISSING = -1.0;

    private ReferenceRecordMapper() {
        // Utility class
    }

    /**
     * Maps a demographic document. Empty if the document has no usable parcel id.
     */
    public static Optional<DemographicRecord> toDemographic(String county, Map<String, Object> document) {
        String parcelId = text(document.get(FIELD_PARCEL_ID));
        if (parcelId == null) {
            return Optional.empty();
        }
        String mobile = text(document.get(FIELD_MOBILE));
        if (mobile == null) {
            mobile = text(document.get(FIELD_PHONE));
        }
        return Optional.of(new DemographicRecord(
                county,
                parcelId,
                text(document.get(FIELD_EMAIL)),
                mobile,
                text(document.get(FIELD_ADDRESS)),
                text(document.get(FIELD_PARCEL_ZIP)),
                text(document.get(FIELD_CUSTOMER_NAME)),
                decimal(document.get(FIELD_ESTIMATED_INCOME)),
                decimal(document.get(FIELD_TOTAL_ENERGY_BURDEN)),
                integer(document.get(FIELD_DEMOGRAPHIC_AGE))
        ));
    }

    /**
     * Maps a residential document. Empty if the document has no usable parcel id.
     */
    public static Optional<ResidentialRecord> toResidential(String county, Map<String, Object> document) {
        String parcelId = text(document.get(FIELD_PARCEL_ID));
        if (parcelId == null) {
            return Optional.empty();
        }
        return Optional.of(new ResidentialRecord(
                county,
                parcelId,
                text(document.get(FIELD_ADDRESS)),
                text(document.get(FIELD_PARCEL_ZIP)),
                integer(document.get(FIELD_YEAR_BUILT))
        ));
    }

    /**
     * Reads a value as text. Integral numbers are rendered without a decimal part,
     * so a phone stored as {@code 6.1455501E9} comes back as {@code "6145550100"}.
     */
    public static String text(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            if (isMissing(number)) {
                return null;
            }
            double asDouble = number.doubleValue();
            if (asDouble == Math.rint(asDouble) && !Double.isInfinite(asDouble)) {
                return new BigDecimal(number.toString()).toBigInteger().toString();
            }
            return number.toString();
        }
        String text = value.toString().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("nan") || text.equals("-1") || text.equals("-1.0")) {
            return null;
        }
        return text;
    }

    /**
     * Reads a value as a double, or null for placeholders and unparseable text.
     */
    public static Double decimal(Object value) {
        if (value instanceof Number number) {
            return isMissing(number) ? null : number.doubleValue();
        }
        String text = text(value);
        if (text == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(text);
            return Double.isNaN(parsed) || parsed == MISSING ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads a value as an integer, or null for placeholders, unparseable text and values
     * outside the {@code int} range.
     */
    public static Integer integer(Object value) {
        Double parsed = decimal(value);
        if (parsed == null || parsed.isInfinite()) {
            return null;
        }
        long rounded = Math.round(parsed);
        return rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE ? null : (int) rounded;
    }

    private static boolean isMissing(Number number) {
        double asDouble = number.doubleValue();
        return Double.isNaN(asDouble) || asDouble == MISSING;
    }
}
