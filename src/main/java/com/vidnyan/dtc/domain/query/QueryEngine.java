package com.vidnyan.dtc.domain.query;

import com.vidnyan.dtc.domain.error.CodeNotFoundException;
import com.vidnyan.dtc.domain.error.InvalidQueryException;
import com.vidnyan.dtc.domain.index.Indices;
import com.vidnyan.dtc.domain.index.TokenOccurrence;
import com.vidnyan.dtc.domain.index.Tokenizer;
import com.vidnyan.dtc.domain.model.CodeCategory;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.model.RecordStore;
import com.vidnyan.dtc.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Answers lookups, attribute filters and keyword searches against one
 * consistent snapshot of store and indices.
 * Immutable and thread-safe; every operation is synchronous and side-effect free.
 */
@Slf4j
public final class QueryEngine {

    private final RecordStore store;
    private final Indices indices;
    private final SearchScorer scorer;

    public QueryEngine(RecordStore store, Indices indices, SearchScorer scorer) {
        this.store = store;
        this.indices = indices;
        this.scorer = scorer;
    }

    /**
     * Get a record by code, case-insensitively.
     *
     * @throws CodeNotFoundException if the code is not in the store
     * @throws InvalidQueryException if the code is blank
     */
    public CodeRecord lookupByCode(String code) {
        String normalized = CodeRecord.normalizeCode(code);
        if (normalized.isEmpty()) {
            throw new InvalidQueryException("code must not be blank");
        }
        return store.get(normalized)
                .orElseThrow(() -> new CodeNotFoundException(normalized));
    }

    /**
     * Records matching every given criterion, in ascending code order.
     *
     * @throws InvalidQueryException if no criterion is given
     */
    public List<CodeRecord> filter(FilterCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            throw new InvalidQueryException("at least one of system, severity or category is required");
        }

        List<SortedSet<String>> buckets = new ArrayList<>();
        if (criteria.hasSystem()) {
            buckets.add(indices.codesForSystem(criteria.system()));
        }
        if (criteria.severity() != null) {
            buckets.add(indices.codesForSeverity(criteria.severity()));
        }
        if (criteria.category() != null) {
            buckets.add(indices.codesForCategory(criteria.category()));
        }

        // Intersect starting from the smallest bucket
        buckets.sort(Comparator.comparingInt(SortedSet::size));
        SortedSet<String> result = new TreeSet<>(buckets.get(0));
        for (int i = 1; i < buckets.size() && !result.isEmpty(); i++) {
            result.retainAll(buckets.get(i));
        }

        log.debug("Filter [{}] matched {} records", criteria.describe(), result.size());
        return result.stream()
                .map(this::requireRecord)
                .toList();
    }

    /**
     * Keyword search ranked by descending score, ties broken by ascending code.
     * A query without usable tokens, or without any match, yields an empty list.
     */
    public List<SearchHit> search(String query) {
        List<String> queryTokens = List.copyOf(new LinkedHashSet<>(Tokenizer.tokenize(query)));
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        // code -> (token -> occurrences in that record)
        Map<String, Map<String, List<TokenOccurrence>>> candidates = new TreeMap<>();
        for (String token : queryTokens) {
            for (TokenOccurrence occurrence : indices.occurrences(token)) {
                candidates.computeIfAbsent(occurrence.code(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(token, k -> new ArrayList<>())
                        .add(occurrence);
            }
        }

        List<SearchHit> hits = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<TokenOccurrence>>> candidate : candidates.entrySet()) {
            double score = scorer.score(queryTokens, candidate.getValue());
            if (score > 0) {
                List<String> matched = queryTokens.stream()
                        .filter(candidate.getValue()::containsKey)
                        .toList();
                hits.add(new SearchHit(requireRecord(candidate.getKey()), score, matched));
            }
        }
        hits.sort(SearchHit.RANKING);

        log.debug("Search '{}' ({} tokens) matched {} records", query, queryTokens.size(), hits.size());
        return List.copyOf(hits);
    }

    /**
     * Distinct system labels in ascending order.
     */
    public List<String> systems() {
        return store.stream()
                .map(CodeRecord::system)
                .distinct()
                .sorted()
                .toList();
    }

    public CorpusStats stats() {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, indices.codesForSeverity(severity).size());
        }
        Map<CodeCategory, Integer> byCategory = new EnumMap<>(CodeCategory.class);
        for (CodeCategory category : CodeCategory.values()) {
            byCategory.put(category, indices.codesForCategory(category).size());
        }
        return new CorpusStats(store.size(), bySeverity, byCategory, systems(), indices.stats().distinctTokens());
    }

    public RecordStore store() {
        return store;
    }

    public Indices indices() {
        return indices;
    }

    private CodeRecord requireRecord(String code) {
        return store.get(code)
                .orElseThrow(() -> new IllegalStateException("Index references unknown code " + code));
    }

    /**
     * Corpus summary statistics.
     */
    public record CorpusStats(
        int totalRecords,
        Map<Severity, Integer> bySeverity,
        Map<CodeCategory, Integer> byCategory,
        List<String> systems,
        int distinctTokens
    ) {}
}
