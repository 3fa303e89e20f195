package com.vidnyan.dtc.domain.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One record block as read from a corpus file, before validation.
 * Values are raw strings; {@code line} is the 1-based line where the block starts.
 * {@code fieldLines} holds the line of each single-valued field where the format
 * spreads a record over several lines.
 */
public record CorpusEntry(
    int line,
    String code,
    String description,
    String severity,
    String system,
    List<String> possibleCauses,
    List<String> recommendedActions,
    Map<Field, Integer> fieldLines
) {

    public enum Field {
        CODE,
        DESCRIPTION,
        SEVERITY,
        SYSTEM
    }

    public CorpusEntry {
        possibleCauses = possibleCauses == null ? List.of() : List.copyOf(possibleCauses);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
        fieldLines = fieldLines == null || fieldLines.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(fieldLines));
    }

    /**
     * Entry whose fields all sit on its start line, e.g. one CSV row.
     */
    public CorpusEntry(int line, String code, String description, String severity, String system,
                       List<String> possibleCauses, List<String> recommendedActions) {
        this(line, code, description, severity, system, possibleCauses, recommendedActions, Map.of());
    }

    /**
     * Line of a field, or the start line when the field is absent.
     */
    public int lineOf(Field field) {
        return fieldLines.getOrDefault(field, line);
    }
}
