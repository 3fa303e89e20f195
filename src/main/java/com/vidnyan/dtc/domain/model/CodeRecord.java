package com.vidnyan.dtc.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A diagnostic code and its reference information.
 * Immutable value object, identity is the normalized code.
 */
public record CodeRecord(
    String code,
    String description,
    Severity severity,
    String system,
    List<String> possibleCauses,
    List<String> recommendedActions
) {

    /** Code as written in a corpus: upper-case category letter, hex digits in either case. */
    public static final Pattern CODE_PATTERN = Pattern.compile("[PCBU][0-9A-Fa-f]{4}");

    public CodeRecord {
        possibleCauses = possibleCauses == null ? List.of() : List.copyOf(possibleCauses);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }

    public CodeCategory category() {
        return CodeCategory.of(code);
    }

    /**
     * Canonical form of a user or corpus supplied code.
     */
    public static String normalizeCode(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Whether a trimmed corpus code is well formed. Checked before normalization,
     * so a lower-case category letter is rejected.
     */
    public static boolean isValidCode(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String code;
        private String description;
        private Severity severity;
        private String system;
        private List<String> possibleCauses = List.of();
        private List<String> recommendedActions = List.of();

        public Builder code(String code) { this.code = code; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder system(String system) { this.system = system; return this; }
        public Builder possibleCauses(List<String> causes) { this.possibleCauses = causes; return this; }
        public Builder recommendedActions(List<String> actions) { this.recommendedActions = actions; return this; }

        public CodeRecord build() {
            return new CodeRecord(code, description, severity, system, possibleCauses, recommendedActions);
        }
    }
}
