package com.vidnyan.dtc.domain.index;

import com.vidnyan.dtc.domain.model.CodeCategory;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.model.RecordStore;
import com.vidnyan.dtc.domain.model.Severity;
import com.vidnyan.dtc.domain.model.SystemCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives {@link Indices} from a record store.
 * Pure function of the store contents: the same corpus always yields identical indices.
 */
@Slf4j
public final class IndexBuilder {

    private IndexBuilder() {
    }

    public static Indices build(RecordStore store) {
        Map<String, SortedSet<String>> bySystem = new TreeMap<>();
        Map<Severity, SortedSet<String>> bySeverity = new EnumMap<>(Severity.class);
        Map<CodeCategory, SortedSet<String>> byCategory = new EnumMap<>(CodeCategory.class);
        Map<String, List<TokenOccurrence>> byToken = new TreeMap<>();

        // Store iterates in code order, so every occurrence list ends up sorted by code
        for (CodeRecord record : store.all()) {
            String code = record.code();
            bySystem.computeIfAbsent(SystemCatalog.key(record.system()), k -> new TreeSet<>()).add(code);
            bySeverity.computeIfAbsent(record.severity(), k -> new TreeSet<>()).add(code);
            byCategory.computeIfAbsent(record.category(), k -> new TreeSet<>()).add(code);

            indexText(byToken, code, TextField.DESCRIPTION, List.of(record.description()));
            indexText(byToken, code, TextField.CAUSE, record.possibleCauses());
            indexText(byToken, code, TextField.ACTION, record.recommendedActions());
        }

        Indices indices = new Indices(
                freezeSets(bySystem),
                freezeSets(bySeverity),
                freezeSets(byCategory),
                freezeLists(byToken)
        );
        log.debug("Built indices for {} records: {}", store.size(), indices.stats());
        return indices;
    }

    private static void indexText(Map<String, List<TokenOccurrence>> byToken, String code,
                                  TextField field, List<String> items) {
        int position = 0;
        for (String item : items) {
            for (String token : Tokenizer.tokenize(item)) {
                byToken.computeIfAbsent(token, k -> new ArrayList<>())
                        .add(new TokenOccurrence(code, field, position++));
            }
        }
    }

    private static <K> Map<K, SortedSet<String>> freezeSets(Map<K, SortedSet<String>> source) {
        source.replaceAll((k, codes) -> Collections.unmodifiableSortedSet(codes));
        return source;
    }

    private static Map<String, List<TokenOccurrence>> freezeLists(Map<String, List<TokenOccurrence>> source) {
        source.replaceAll((k, occurrences) -> List.copyOf(occurrences));
        return source;
    }
}
