package com.example.voice.service;

import org.springframework.util.StringUtils;

/**
 * Canonical form for phone keys: digits only, North American numbers prefixed with country code 1.
 */
public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    public static String normalize(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        if (digits.length() == 10) {
            return "1" + digits;
        }
        return digits;
    }
}
