package com.contact.resolution.rules;

import com.contact.resolution.core.model.HandleKind;

/**
 * Canonicalizes phone numbers and email addresses into comparable keys.
 *
 * <ul>
 *   <li>Phones: digits only ({@code "+1 (212) 555-1234"} becomes {@code "12125551234"}).</li>
 *   <li>Emails: lowercased and trimmed.</li>
 * </ul>
 *
 * <p>All methods are pure and total: no exceptions, no I/O, and normalizing an
 * already-normalized value returns it unchanged.</p>
 */
public final class HandleNormalizer {

    /** Fewer digits than this and a non-email handle is not treated as a phone number. */
    public static final int MIN_PHONE_DIGITS = 7;

    /** Digits kept for matching numbers with and without a country code. */
    public static final int PHONE_SUFFIX_LENGTH = 10;

    private static final NormalizationEngine ENGINE = DefaultNormalizationRules.createDefaultEngine();

    private HandleNormalizer() {
        // Utility class
    }

    public static String normalizePhone(String raw) {
        return ENGINE.normalize(raw, HandleKind.PHONE);
    }

    public static String normalizeEmail(String raw) {
        return ENGINE.normalize(raw, HandleKind.EMAIL);
    }

    /**
     * Decides how a raw handle should be normalized: anything containing {@code @}
     * is an email, anything else with at least {@value #MIN_PHONE_DIGITS} digits is a
     * phone, and the rest is {@link HandleKind#UNKNOWN}.
     */
    public static HandleKind classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return HandleKind.UNKNOWN;
        }
        if (raw.indexOf('@') >= 0) {
            return HandleKind.EMAIL;
        }
        return countDigits(raw) >= MIN_PHONE_DIGITS ? HandleKind.PHONE : HandleKind.UNKNOWN;
    }

    /**
     * Classifies and normalizes in one step. {@link HandleKind#UNKNOWN} handles
     * normalize to an empty string.
     */
    public static String normalize(String raw) {
        return switch (classify(raw)) {
            case PHONE -> normalizePhone(raw);
            case EMAIL -> normalizeEmail(raw);
            case UNKNOWN -> "";
        };
    }

    /**
     * Returns the trailing {@value #PHONE_SUFFIX_LENGTH} digits of a normalized phone,
     * or the value itself when it is not longer than that.
     */
    public static String phoneSuffix(String normalizedPhone) {
        if (normalizedPhone == null) {
            return "";
        }
        int length = normalizedPhone.length();
        return length > PHONE_SUFFIX_LENGTH
                ? normalizedPhone.substring(length - PHONE_SUFFIX_LENGTH)
                : normalizedPhone;
    }

    private static int countDigits(String value) {
        int digits = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                digits++;
            }
        }
        return digits;
    }
}
