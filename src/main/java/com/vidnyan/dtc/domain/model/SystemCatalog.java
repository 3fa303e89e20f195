package com.vidnyan.dtc.domain.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Near-closed set of vehicle system labels.
 * Labels are matched on a whitespace-collapsed, case-insensitive key; the catalog spelling wins.
 * A strict catalog rejects labels it does not know.
 */
public final class SystemCatalog {

    private final Map<String, String> canonicalByKey;
    private final boolean strict;

    private SystemCatalog(Map<String, String> canonicalByKey, boolean strict) {
        this.canonicalByKey = canonicalByKey;
        this.strict = strict;
    }

    public static SystemCatalog of(Collection<String> knownSystems, boolean strict) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String label : knownSystems) {
            String cleaned = clean(label);
            if (!cleaned.isEmpty()) {
                byKey.putIfAbsent(key(cleaned), cleaned);
            }
        }
        return new SystemCatalog(Map.copyOf(byKey), strict && !byKey.isEmpty());
    }

    /**
     * Catalog accepting any non-blank label.
     */
    public static SystemCatalog open() {
        return new SystemCatalog(Map.of(), false);
    }

    /**
     * Canonical label for a raw value, empty when the value is blank or, in strict mode, unknown.
     */
    public Optional<String> canonicalize(String raw) {
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        String known = canonicalByKey.get(key(cleaned));
        if (known != null) {
            return Optional.of(known);
        }
        return strict ? Optional.empty() : Optional.of(cleaned);
    }

    public boolean isStrict() {
        return strict;
    }

    public List<String> knownSystems() {
        return canonicalByKey.values().stream().sorted().toList();
    }

    /**
     * Lookup key shared by index buckets and filter criteria.
     */
    public static String key(String label) {
        return clean(label).toLowerCase(Locale.ROOT);
    }

    private static String clean(String raw) {
        return raw == null ? "" : raw.trim().replaceAll("\\s+", " ");
    }
}
