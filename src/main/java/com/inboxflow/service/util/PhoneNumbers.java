package com.inboxflow.service.util;

/**
 * Phone numbers are stored as "+" followed by digits only.
 *
 *   "15551234567"      → "+15551234567"
 *   "+1 (555) 123-4567" → "+15551234567"
 *   "0044 20 7946 0000" → "+442079460000"
 */
public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String digits = raw.replaceAll("[^0-9]", "");
        if (digits.startsWith("00")) {
            digits = digits.substring(2);
        }
        return digits.isEmpty() ? "" : "+" + digits;
    }

    /** Provider send calls expect the recipient without the leading "+". */
    public static String toProviderFormat(String phone) {
        String normalized = normalize(phone);
        return normalized.isEmpty() ? "" : normalized.substring(1);
    }
}
