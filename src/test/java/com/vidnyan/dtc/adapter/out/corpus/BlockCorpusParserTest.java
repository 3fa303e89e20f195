package com.vidnyan.dtc.adapter.out.corpus;

import com.vidnyan.dtc.TestCorpus;
import com.vidnyan.dtc.domain.error.CorpusLoadException;
import com.vidnyan.dtc.domain.model.CorpusEntry;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockCorpusParserTest {

    private final BlockCorpusParser parser = new BlockCorpusParser();

    @Test
    void parse_ShouldReadAllBlocks() {
        List<CorpusEntry> entries = parse(TestCorpus.SAMPLE);

        assertEquals(2, entries.size());
        CorpusEntry first = entries.get(0);
        assertEquals(1, first.line());
        assertEquals("P0300", first.code());
        assertEquals("Random/Multiple Cylinder Misfire Detected", first.description());
        assertEquals("High", first.severity());
        assertEquals("Engine", first.system());
        assertEquals(5, first.possibleCauses().size());
        assertEquals("Perform compression test", first.recommendedActions().get(4));
        assertEquals(18, entries.get(1).line());
        assertEquals(3, first.lineOf(CorpusEntry.Field.SEVERITY));
        assertEquals(4, first.lineOf(CorpusEntry.Field.SYSTEM));
    }

    @Test
    void parse_ShouldSkipCommentsAndExtraBlankLines() {
        String text = """
                # header comment


                Error Code: P0420
                # inline comment
                Description: Catalyst System Efficiency Below Threshold
                Severity: Medium
                System: Exhaust
                Possible Causes:
                  * Failing catalytic converter
                  • Faulty oxygen sensor
                Recommended Actions:
                  - Replace catalytic converter
                """;

        List<CorpusEntry> entries = parse(text);

        assertEquals(1, entries.size());
        assertEquals(4, entries.get(0).line());
        assertEquals(List.of("Failing catalytic converter", "Faulty oxygen sensor"), entries.get(0).possibleCauses());
    }

    @Test
    void parse_ShouldAcceptInlineListItems() {
        String text = """
                Error Code: P0562
                Description: System Voltage Low
                Severity: Medium
                System: Charging
                Possible Causes: Weak battery | Failing alternator
                Recommended Actions: Test the battery
                """;

        CorpusEntry entry = parse(text).get(0);

        assertEquals(List.of("Weak battery", "Failing alternator"), entry.possibleCauses());
        assertEquals(List.of("Test the battery"), entry.recommendedActions());
    }

    @Test
    void parse_NewCodeLineShouldStartNewBlock() {
        String text = """
                Error Code: P0001
                Description: First
                Severity: Low
                System: Engine
                Error Code: P0002
                Description: Second
                Severity: Low
                System: Engine
                """;

        List<CorpusEntry> entries = parse(text);

        assertEquals(List.of("P0001", "P0002"), entries.stream().map(CorpusEntry::code).toList());
        assertEquals(5, entries.get(1).line());
    }

    @Test
    void parse_ShouldLeaveMissingFieldsNull() {
        CorpusEntry entry = parse("Error Code: P0001\nDescription: Only a description\n").get(0);

        assertNull(entry.severity());
        assertNull(entry.system());
        assertTrue(entry.possibleCauses().isEmpty());
    }

    @Test
    void parse_ShouldRejectUnknownField() {
        CorpusLoadException e = assertThrows(CorpusLoadException.class,
                () -> parse("Error Code: P0001\nColour: red\n"));

        assertEquals(2, e.getLine());
        assertTrue(e.getReason().contains("unrecognized field 'Colour'"));
    }

    @Test
    void parse_ShouldRejectDuplicateField() {
        CorpusLoadException e = assertThrows(CorpusLoadException.class,
                () -> parse("Error Code: P0001\nSeverity: Low\nSeverity: High\n"));

        assertEquals(3, e.getLine());
        assertTrue(e.getReason().contains("duplicate field"));
    }

    @Test
    void parse_ShouldRejectStrayListItem() {
        CorpusLoadException e = assertThrows(CorpusLoadException.class,
                () -> parse("Error Code: P0001\nSeverity: Low\n  - orphan\n"));

        assertEquals(3, e.getLine());
    }

    @Test
    void parse_ShouldRejectFieldOutsideBlock() {
        CorpusLoadException e = assertThrows(CorpusLoadException.class,
                () -> parse("Description: no code yet\n"));

        assertEquals(1, e.getLine());
        assertEquals("line 1: " + e.getReason(), e.getMessage());
    }

    @Test
    void parse_ShouldRejectLineWithoutKey() {
        assertThrows(CorpusLoadException.class, () -> parse("Error Code: P0001\njust some text\n"));
    }

    @Test
    void parse_EmptyInputShouldYieldNoEntries() {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("# nothing here\n\n").isEmpty());
    }

    private List<CorpusEntry> parse(String text) {
        return parser.parse(new StringReader(text));
    }
}
