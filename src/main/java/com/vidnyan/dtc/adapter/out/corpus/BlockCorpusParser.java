package com.vidnyan.dtc.adapter.out.corpus;

import com.vidnyan.dtc.domain.error.CorpusLoadException;
import com.vidnyan.dtc.domain.model.CorpusEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the key-value block corpus format:
 * <pre>
 * Error Code: P0300
 * Description: Random/Multiple Cylinder Misfire Detected
 * Severity: High
 * System: Engine
 * Possible Causes:
 *   - Spark plug issues
 * Recommended Actions:
 *   - Check spark plugs
 * </pre>
 * Blocks are separated by blank lines; lines starting with '#' are comments.
 * A list key may also carry its items inline, separated by '|'.
 * Only structure is checked here; field values are validated by the record store,
 * which reports each bad value at the line of its own field.
 */
@Slf4j
public class BlockCorpusParser {

    enum Key {
        ERROR_CODE("error code"),
        DESCRIPTION("description"),
        SEVERITY("severity"),
        SYSTEM("system"),
        POSSIBLE_CAUSES("possible causes"),
        RECOMMENDED_ACTIONS("recommended actions");

        private final String label;

        Key(String label) {
            this.label = label;
        }

        boolean isList() {
            return this == POSSIBLE_CAUSES || this == RECOMMENDED_ACTIONS;
        }

        static Optional<Key> parse(String raw) {
            String normalized = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            for (Key key : values()) {
                if (key.label.equals(normalized)) {
                    return Optional.of(key);
                }
            }
            return Optional.empty();
        }
    }

    public List<CorpusEntry> parse(Reader source) {
        List<CorpusEntry> entries = new ArrayList<>();
        BlockBuilder block = null;
        int lineNo = 0;

        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.strip();

                if (trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.isEmpty()) {
                    if (block != null) {
                        entries.add(block.build());
                        block = null;
                    }
                    continue;
                }

                if (isBullet(trimmed)) {
                    if (block == null || block.openList == null) {
                        throw new CorpusLoadException(lineNo,
                                "list item outside of 'Possible Causes' or 'Recommended Actions'");
                    }
                    block.addItem(trimmed.substring(1).trim());
                    continue;
                }

                int colon = trimmed.indexOf(':');
                if (colon <= 0) {
                    throw new CorpusLoadException(lineNo, "expected 'Key: value' but found '" + trimmed + "'");
                }
                String rawKey = trimmed.substring(0, colon);
                String value = trimmed.substring(colon + 1).trim();
                final int currentLine = lineNo;
                Key key = Key.parse(rawKey)
                        .orElseThrow(() -> new CorpusLoadException(currentLine,
                                "unrecognized field '" + rawKey.trim() + "'"));

                if (key == Key.ERROR_CODE) {
                    // A new code line also ends a block that was not followed by a blank line
                    if (block != null) {
                        entries.add(block.build());
                    }
                    block = new BlockBuilder(lineNo, value);
                    continue;
                }
                if (block == null) {
                    throw new CorpusLoadException(lineNo,
                            "'" + rawKey.trim() + "' outside of a record block (blocks start with 'Error Code:')");
                }
                block.set(key, value, lineNo);
            }
        } catch (IOException e) {
            throw new CorpusLoadException(lineNo, "failed to read corpus: " + e.getMessage(), e);
        }

        if (block != null) {
            entries.add(block.build());
        }
        log.debug("Parsed {} record blocks from {} lines", entries.size(), lineNo);
        return entries;
    }

    private static boolean isBullet(String trimmed) {
        char first = trimmed.charAt(0);
        return first == '-' || first == '*' || first == '•';
    }

    private static final class BlockBuilder {
        private final int startLine;
        private final String code;
        private final Set<Key> seen = EnumSet.of(Key.ERROR_CODE);
        private String description;
        private String severity;
        private String system;
        private final List<String> causes = new ArrayList<>();
        private final List<String> actions = new ArrayList<>();
        private final Map<CorpusEntry.Field, Integer> fieldLines = new EnumMap<>(CorpusEntry.Field.class);
        private Key openList;

        BlockBuilder(int startLine, String code) {
            this.startLine = startLine;
            this.code = code;
            fieldLines.put(CorpusEntry.Field.CODE, startLine);
        }

        void set(Key key, String value, int lineNo) {
            if (!seen.add(key)) {
                throw new CorpusLoadException(lineNo, "duplicate field '" + key.label + "' in record " + code);
            }
            openList = key.isList() ? key : null;
            switch (key) {
                case DESCRIPTION -> {
                    description = value;
                    fieldLines.put(CorpusEntry.Field.DESCRIPTION, lineNo);
                }
                case SEVERITY -> {
                    severity = value;
                    fieldLines.put(CorpusEntry.Field.SEVERITY, lineNo);
                }
                case SYSTEM -> {
                    system = value;
                    fieldLines.put(CorpusEntry.Field.SYSTEM, lineNo);
                }
                case POSSIBLE_CAUSES, RECOMMENDED_ACTIONS -> {
                    if (!value.isEmpty()) {
                        for (String item : value.split("\\|")) {
                            addItem(item.trim());
                        }
                    }
                }
                default -> throw new IllegalStateException("Unexpected key " + key);
            }
        }

        void addItem(String item) {
            if (item.isEmpty()) {
                return;
            }
            if (openList == Key.POSSIBLE_CAUSES) {
                causes.add(item);
            } else {
                actions.add(item);
            }
        }

        CorpusEntry build() {
            return new CorpusEntry(startLine, code, description, severity, system, causes, actions, fieldLines);
        }
    }
}
