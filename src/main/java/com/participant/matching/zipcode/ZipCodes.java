package com.participant.matching.zipcode;

import java.math.BigDecimal;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Parsing helpers for ZIP values as they appear in reference documents.
 */
public final class ZipCodes {

    private static final Pattern ZIP_TEXT = Pattern.compile("^(\\d{1,5})(?:-\\d{4}|\\.0+)?$");

    private ZipCodes() {
        // Utility class
    }

    /**
     * Parses a raw {@code parcel_zip} value: an integer, a whole double, a numeric string
     * or a ZIP+4 string. Placeholders ({@code -1}, {@code NaN}, zero), fractions and
     * non-numeric text are rejected.
     */
    public static OptionalInt parse(Object raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
                return OptionalInt.empty();
            }
            return valid(new BigDecimal(number.toString()).longValue());
        }
        var matcher = ZIP_TEXT.matcher(raw.toString().trim());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        return valid(Long.parseLong(matcher.group(1)));
    }

    /**
     * Formats a ZIP as a five-digit, zero-padded string.
     */
    public static String format(int zip) {
        return String.format("%05d", zip);
    }

    private static OptionalInt valid(long zip) {
        return zip > 0 && zip <= 99_999 ? OptionalInt.of((int) zip) : OptionalInt.empty();
    }
}
