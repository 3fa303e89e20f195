package com.vidnyan.dtc.domain.index;

import com.vidnyan.dtc.domain.model.CodeCategory;
import com.vidnyan.dtc.domain.model.Severity;
import com.vidnyan.dtc.domain.model.SystemCatalog;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Secondary indices over a {@link com.vidnyan.dtc.domain.model.RecordStore}.
 * Built completely by {@link IndexBuilder} before publication and never mutated afterwards.
 * Immutable and thread-safe.
 */
public final class Indices {

    private static final SortedSet<String> NO_CODES = Collections.unmodifiableSortedSet(new TreeSet<>());

    private final Map<String, SortedSet<String>> bySystem;
    private final Map<Severity, SortedSet<String>> bySeverity;
    private final Map<CodeCategory, SortedSet<String>> byCategory;
    private final Map<String, List<TokenOccurrence>> byToken;

    Indices(
            Map<String, SortedSet<String>> bySystem,
            Map<Severity, SortedSet<String>> bySeverity,
            Map<CodeCategory, SortedSet<String>> byCategory,
            Map<String, List<TokenOccurrence>> byToken
    ) {
        this.bySystem = Collections.unmodifiableMap(bySystem);
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byCategory = Collections.unmodifiableMap(byCategory);
        this.byToken = Collections.unmodifiableMap(byToken);
    }

    /**
     * Codes attributed to a system, matched through {@link SystemCatalog#key}.
     */
    public SortedSet<String> codesForSystem(String system) {
        return bySystem.getOrDefault(SystemCatalog.key(system), NO_CODES);
    }

    public SortedSet<String> codesForSeverity(Severity severity) {
        return bySeverity.getOrDefault(severity, NO_CODES);
    }

    public SortedSet<String> codesForCategory(CodeCategory category) {
        return byCategory.getOrDefault(category, NO_CODES);
    }

    /**
     * Occurrences of an already normalized token, ordered by code, field and position.
     */
    public List<TokenOccurrence> occurrences(String token) {
        return byToken.getOrDefault(token, List.of());
    }

    public Set<String> systemKeys() {
        return bySystem.keySet();
    }

    public Set<String> tokens() {
        return byToken.keySet();
    }

    public Stats stats() {
        return new Stats(
                bySystem.size(),
                byToken.size(),
                byToken.values().stream().mapToLong(List::size).sum()
        );
    }

    public record Stats(
        int systemBuckets,
        int distinctTokens,
        long tokenOccurrences
    ) {}
}
