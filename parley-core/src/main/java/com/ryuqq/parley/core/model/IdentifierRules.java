package com.ryuqq.parley.core.model;

import java.util.regex.Pattern;

/**
 * 식별자 값 유효성 규칙.
 */
final class IdentifierRules {

    static final int MAX_LENGTH = 255;

    static final Pattern VALUE_PATTERN = Pattern.compile("^[A-Za-z0-9_.\\-]+$");

    private IdentifierRules() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String requireValid(String typeName, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(typeName + " cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(typeName + " length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALUE_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(typeName + " contains invalid characters: '" + value + "'");
        }
        return value;
    }

    static boolean isValidValue(String value) {
        return value != null
            && !value.isEmpty()
            && value.length() <= MAX_LENGTH
            && VALUE_PATTERN.matcher(value).matches();
    }
}
