package com.vidnyan.dtc.domain.model;

import com.vidnyan.dtc.domain.error.CorpusLoadException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * The loaded code records, keyed by normalized code.
 * Immutable after {@link #load}; safe for unsynchronized concurrent reads.
 */
@Slf4j
public final class RecordStore {

    private final Map<String, CodeRecord> records;
    private final List<CodeRecord> ordered;

    private RecordStore(TreeMap<String, CodeRecord> records) {
        this.records = Collections.unmodifiableMap(records);
        this.ordered = List.copyOf(records.values());
    }

    /**
     * Validate every entry and build the store. Any invalid entry fails the whole load.
     *
     * @throws CorpusLoadException on duplicate or malformed code, empty description,
     *                             unrecognized severity or unknown system
     */
    public static RecordStore load(List<CorpusEntry> entries, SystemCatalog systems) {
        TreeMap<String, CodeRecord> byCode = new TreeMap<>();
        Map<String, Integer> firstSeenAt = new HashMap<>();

        for (CorpusEntry entry : entries) {
            CodeRecord record = validate(entry, systems);
            Integer previous = firstSeenAt.putIfAbsent(record.code(), entry.line());
            if (previous != null) {
                throw new CorpusLoadException(entry.line(),
                        "duplicate code " + record.code() + " (first defined at line " + previous + ")");
            }
            byCode.put(record.code(), record);
        }

        log.debug("Validated {} code records", byCode.size());
        return new RecordStore(byCode);
    }

    private static CodeRecord validate(CorpusEntry entry, SystemCatalog systems) {
        int codeLine = entry.lineOf(CorpusEntry.Field.CODE);

        if (entry.code() == null || entry.code().isBlank()) {
            throw new CorpusLoadException(codeLine, "missing error code");
        }
        String rawCode = entry.code().trim();
        if (!CodeRecord.isValidCode(rawCode)) {
            throw new CorpusLoadException(codeLine, "malformed code '" + rawCode
                    + "' (expected an upper-case P, C, B or U prefix followed by 4 hex digits)");
        }
        String code = CodeRecord.normalizeCode(rawCode);

        if (entry.description() == null || entry.description().isBlank()) {
            throw new CorpusLoadException(entry.lineOf(CorpusEntry.Field.DESCRIPTION), "empty description for " + code);
        }

        Severity severity = Severity.parse(entry.severity())
                .orElseThrow(() -> new CorpusLoadException(entry.lineOf(CorpusEntry.Field.SEVERITY),
                        "unrecognized severity '" + nullToEmpty(entry.severity()) + "' for " + code
                                + " (expected Low, Medium, High or Critical)"));

        String system = systems.canonicalize(entry.system())
                .orElseThrow(() -> new CorpusLoadException(entry.lineOf(CorpusEntry.Field.SYSTEM),
                        (entry.system() == null || entry.system().isBlank() ? "missing system"
                                : "unknown system '" + entry.system().trim() + "'") + " for " + code));

        return CodeRecord.builder()
                .code(code)
                .description(entry.description().trim())
                .severity(severity)
                .system(system)
                .possibleCauses(trimAll(entry.possibleCauses()))
                .recommendedActions(trimAll(entry.recommendedActions()))
                .build();
    }

    /**
     * Get a record by code. The code is normalized first.
     */
    public Optional<CodeRecord> get(String code) {
        return Optional.ofNullable(records.get(CodeRecord.normalizeCode(code)));
    }

    public boolean contains(String code) {
        return records.containsKey(CodeRecord.normalizeCode(code));
    }

    /**
     * All records in ascending code order, as an immutable list.
     */
    public List<CodeRecord> all() {
        return ordered;
    }

    public Stream<CodeRecord> stream() {
        return ordered.stream();
    }

    public int size() {
        return records.size();
    }

    private static List<String> trimAll(List<String> items) {
        return items.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
