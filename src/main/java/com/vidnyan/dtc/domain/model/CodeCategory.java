package com.vidnyan.dtc.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Code category, denoted by the first character of a code.
 */
public enum CodeCategory {
    POWERTRAIN('P'),
    CHASSIS('C'),
    BODY('B'),
    NETWORK('U');

    private final char prefix;

    CodeCategory(char prefix) {
        this.prefix = prefix;
    }

    public char prefix() {
        return prefix;
    }

    /**
     * Category of an already normalized code.
     */
    public static CodeCategory of(String code) {
        return fromPrefix(code.charAt(0))
                .orElseThrow(() -> new IllegalArgumentException("Not a diagnostic code: " + code));
    }

    public static Optional<CodeCategory> fromPrefix(char c) {
        char upper = Character.toUpperCase(c);
        for (CodeCategory category : values()) {
            if (category.prefix == upper) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Accepts either the prefix letter ("P") or the name ("powertrain").
     */
    public static Optional<CodeCategory> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        if (trimmed.length() == 1) {
            return fromPrefix(trimmed.charAt(0));
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        for (CodeCategory category : values()) {
            if (category.name().equals(upper)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
