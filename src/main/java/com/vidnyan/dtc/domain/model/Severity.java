package com.vidnyan.dtc.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Diagnostic code severity levels.
 * Declaration order is the total order used for filtering and sorting (LOW lowest).
 */
public enum Severity {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    /**
     * Display label as it appears in the corpus.
     */
    public String label() {
        return label;
    }

    /**
     * Parse a severity token, ignoring case and surrounding whitespace.
     */
    public static Optional<Severity> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
