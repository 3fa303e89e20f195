package com.vidnyan.dtc.adapter.out.corpus;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.vidnyan.dtc.domain.error.CorpusLoadException;
import com.vidnyan.dtc.domain.model.CorpusEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the CSV corpus format with header
 * {@code code,description,severity,system,possible_causes,recommended_actions}.
 * List columns hold items separated by '|'. Blank lines and rows whose values are all
 * blank are skipped. Each entry carries the file line its row starts on, so quoted
 * cells spanning several lines do not shift later line numbers.
 */
@Slf4j
public class CsvCorpusParser {

    static final List<String> REQUIRED_COLUMNS = List.of(
            "code", "description", "severity", "system", "possible_causes", "recommended_actions");

    private final CsvMapper csvMapper;

    public CsvCorpusParser() {
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }

    public List<CorpusEntry> parse(Reader source) {
        String text = readAll(source);
        List<Integer> rowLines = rowStartLines(text);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<CorpusEntry> entries = new ArrayList<>();
        int rowIndex = 0;
        int lineNo = 1;

        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(new StringReader(text))) {

            while (rows.hasNextValue()) {
                rowIndex++;
                lineNo = rowIndex < rowLines.size() ? rowLines.get(rowIndex) : lineNo + 1;
                Map<String, String> row = normalizeColumns(rows.nextValue());
                if (row.values().stream().allMatch(v -> v == null || v.isBlank())) {
                    continue;
                }
                if (entries.isEmpty()) {
                    checkColumns(row);
                }
                entries.add(new CorpusEntry(
                        lineNo,
                        row.get("code"),
                        row.get("description"),
                        row.get("severity"),
                        row.get("system"),
                        splitItems(row.get("possible_causes")),
                        splitItems(row.get("recommended_actions"))));
            }
        } catch (IOException e) {
            throw new CorpusLoadException(lineNo, "malformed CSV: " + e.getMessage(), e);
        }

        log.debug("Parsed {} CSV rows", entries.size());
        return entries;
    }

    private static String readAll(Reader source) {
        try (Reader reader = source) {
            StringWriter text = new StringWriter();
            reader.transferTo(text);
            return text.toString();
        } catch (IOException e) {
            throw new CorpusLoadException(0, "failed to read corpus: " + e.getMessage(), e);
        }
    }

    /**
     * 1-based start line of every non-blank row, header included, following the
     * quoting rules the CSV parser applies: a quote opening a cell runs to the
     * matching quote, {@code ""} escapes a quote, and line breaks inside it belong to the cell.
     */
    static List<Integer> rowStartLines(String text) {
        List<Integer> starts = new ArrayList<>();
        int line = 1;
        int rowLine = 1;
        boolean inQuotes = false;
        boolean cellStart = true;
        boolean blank = true;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean lineBreak = c == '\n' || c == '\r';
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            }

            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else if (lineBreak) {
                    line++;
                }
                continue;
            }

            if (lineBreak) {
                if (!blank) {
                    starts.add(rowLine);
                }
                line++;
                rowLine = line;
                cellStart = true;
                blank = true;
                continue;
            }

            if (!Character.isWhitespace(c)) {
                blank = false;
            }
            if (c == '"' && cellStart) {
                inQuotes = true;
                cellStart = false;
            } else if (c == ',') {
                cellStart = true;
            } else if (c != ' ' && c != '\t') {
                cellStart = false;
            }
        }
        if (!blank) {
            starts.add(rowLine);
        }
        return starts;
    }

    private static void checkColumns(Map<String, String> row) {
        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(column -> !row.containsKey(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new CorpusLoadException(1, "missing CSV column(s) " + String.join(", ", missing));
        }
    }

    private static Map<String, String> normalizeColumns(Map<String, String> row) {
        Map<String, String> normalized = new HashMap<>();
        row.forEach((column, value) -> normalized.put(
                column.trim().toLowerCase(Locale.ROOT).replace(' ', '_'), value));
        return normalized;
    }

    private static List<String> splitItems(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split("\\|"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
