package com.participant.matching.rules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw email, phone, ZIP and street values into comparable lookup keys.
 *
 * <p>Every method is pure and idempotent, and returns {@code null} instead of throwing
 * when the input is missing or unusable. A {@code null} key simply takes that identity
 * signal out of the matching chain.</p>
 */
public class IdentityNormalizer {

    public static final String ADDRESS_KEY_SEPARATOR = "|";

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern WHOLE_DECIMAL = Pattern.compile("^(\\d+)\\.0+$");
    private static final int PHONE_LENGTH = 10;
    private static final int ZIP_LENGTH = 5;

    private final NormalizationEngine addressEngine;

    public IdentityNormalizer(NormalizationEngine addressEngine) {
        this.addressEngine = addressEngine;
    }

    /**
     * Creates a normalizer using {@link AddressNormalizationRules#createDefaultEngine()}.
     */
    public static IdentityNormalizer defaults() {
        return new IdentityNormalizer(AddressNormalizationRules.createDefaultEngine());
    }

    /**
     * Trims and lower-cases an email. Returns null if empty or without an {@code @}.
     */
    public String normalizeEmail(String raw) {
        if (raw == null) {
            return null;
        }
        String email = raw.trim().toLowerCase(Locale.ROOT);
        if (email.isEmpty() || email.indexOf('@') < 0) {
            return null;
        }
        return email;
    }

    /**
     * Reduces a phone number to exactly ten digits, dropping a leading U.S. country code.
     * Returns null for anything that does not reduce to ten digits.
     */
    public String normalizePhone(String raw) {
        if (raw == null) {
            return null;
        }
        String digits = NON_DIGITS.matcher(stripWholeDecimal(raw.trim())).replaceAll("");
        if (digits.length() == PHONE_LENGTH + 1 && digits.charAt(0) == '1') {
            digits = digits.substring(1);
        }
        return digits.length() == PHONE_LENGTH ? digits : null;
    }

    /**
     * Reduces a ZIP or ZIP+4 to its five-digit form. Numeric ZIPs that lost their leading
     * zeros are padded back. Negative placeholders such as {@code -1} yield null.
     */
    public String normalizeZip(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("-")) {
            return null;
        }
        String digits = NON_DIGITS.matcher(stripWholeDecimal(trimmed)).replaceAll("");
        if (digits.isEmpty()) {
            return null;
        }
        if (digits.length() >= ZIP_LENGTH) {
            return digits.substring(0, ZIP_LENGTH);
        }
        return "0".repeat(ZIP_LENGTH - digits.length()) + digits;
    }

    /**
     * Normalizes a street line: upper-case, punctuation removed, whitespace collapsed,
     * suffixes and directionals in canonical form. Returns null if blank.
     */
    public String normalizeStreet(String street) {
        String normalized = addressEngine.normalize(street);
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * Builds the address key {@code STREET|ZIP5}. Returns null if either part is unusable.
     */
    public String normalizeAddress(String street, String zip) {
        String streetKey = normalizeStreet(street);
        String zipKey = normalizeZip(zip);
        if (streetKey == null || zipKey == null) {
            return null;
        }
        return streetKey + ADDRESS_KEY_SEPARATOR + zipKey;
    }

    private static String stripWholeDecimal(String value) {
        // Spreadsheet exports turn numeric columns into "43201.0"
        var matcher = WHOLE_DECIMAL.matcher(value);
        return matcher.matches() ? matcher.group(1) : value;
    }
}
