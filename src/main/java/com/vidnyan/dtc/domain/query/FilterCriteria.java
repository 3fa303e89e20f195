package com.vidnyan.dtc.domain.query;

import com.vidnyan.dtc.domain.model.CodeCategory;
import com.vidnyan.dtc.domain.model.Severity;

/**
 * Attribute filter. Every non-null criterion must match; at least one is required.
 */
public record FilterCriteria(
    String system,
    Severity severity,
    CodeCategory category
) {

    public static FilterCriteria bySystem(String system) {
        return new FilterCriteria(system, null, null);
    }

    public static FilterCriteria bySeverity(Severity severity) {
        return new FilterCriteria(null, severity, null);
    }

    public static FilterCriteria of(String system, Severity severity) {
        return new FilterCriteria(system, severity, null);
    }

    public static FilterCriteria none() {
        return new FilterCriteria(null, null, null);
    }

    public boolean hasSystem() {
        return system != null && !system.isBlank();
    }

    public boolean isEmpty() {
        return !hasSystem() && severity == null && category == null;
    }

    public FilterCriteria withCategory(CodeCategory category) {
        return new FilterCriteria(system, severity, category);
    }

    /**
     * Short human-readable description, e.g. {@code system=Engine, severity=High}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (hasSystem()) {
            sb.append("system=").append(system.trim());
        }
        if (severity != null) {
            sb.append(sb.length() > 0 ? ", " : "").append("severity=").append(severity.label());
        }
        if (category != null) {
            sb.append(sb.length() > 0 ? ", " : "").append("category=").append(category.prefix());
        }
        return sb.toString();
    }
}
