package com.example.fok.service;

import java.util.Optional;

/**
 * Russian mobile number parsing. Normalized numbers look like {@code +79991234567}.
 */
public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /**
     * Accepts 10 digits starting with 9, or 11 digits starting with 7 or 8 followed by 9.
     */
    public static boolean isValidMobile(String raw) {
        String digits = digitsOf(raw);
        if (digits.length() == 10) {
            return digits.charAt(0) == '9';
        }
        if (digits.length() == 11) {
            char first = digits.charAt(0);
            return (first == '7' || first == '8') && digits.charAt(1) == '9';
        }
        return false;
    }

    public static Optional<String> normalize(String raw) {
        String digits = digitsOf(raw);
        if (digits.length() == 10 && digits.charAt(0) == '9') {
            return Optional.of("+7" + digits);
        }
        if (digits.length() == 11 && (digits.charAt(0) == '7' || digits.charAt(0) == '8')) {
            return Optional.of("+7" + digits.substring(1));
        }
        return Optional.empty();
    }

    /**
     * Numbers shared through the messenger's contact button are trusted; foreign numbers keep their digits.
     */
    public static Optional<String> normalizeShared(String raw) {
        Optional<String> normalized = normalize(raw);
        if (normalized.isPresent()) {
            return normalized;
        }
        String digits = digitsOf(raw);
        return digits.length() >= 10 && digits.length() <= 15 ? Optional.of("+" + digits) : Optional.empty();
    }

    private static String digitsOf(String raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }
}
