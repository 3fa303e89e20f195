package com.vidnyan.dtc.application.port.out;

import java.util.Locale;
import java.util.Optional;

public enum OutputFormat {
    TEXT,
    HTML,
    JSON;

    public static Optional<OutputFormat> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "text", "txt" -> Optional.of(TEXT);
            case "html", "htm" -> Optional.of(HTML);
            case "json" -> Optional.of(JSON);
            default -> Optional.empty();
        };
    }

    /**
     * Infer a format from an output file name, defaulting to TEXT.
     */
    public static OutputFormat forFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".html") || lower.endsWith(".htm")) {
            return HTML;
        }
        if (lower.endsWith(".json")) {
            return JSON;
        }
        return TEXT;
    }
}
