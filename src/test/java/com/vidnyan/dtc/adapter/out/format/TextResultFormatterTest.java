package com.vidnyan.dtc.adapter.out.format;

import com.vidnyan.dtc.TestCorpus;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.model.RecordStore;
import com.vidnyan.dtc.domain.model.Severity;
import com.vidnyan.dtc.domain.query.FilterCriteria;
import com.vidnyan.dtc.domain.query.QueryEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextResultFormatterTest {

    private final TextResultFormatter formatter = new TextResultFormatter();
    private final QueryEngine engine = TestCorpus.sampleEngine();

    @Test
    void formatRecord_ShouldRenderBlockFormat() {
        String text = formatter.formatRecord(engine.lookupByCode("P0171"));

        assertEquals("""
                Error Code: P0171
                Description: System Too Lean (Bank 1)
                Severity: Medium
                System: Fuel System
                Possible Causes:
                  - Vacuum leak
                  - Dirty or faulty MAF sensor
                  - Weak fuel pump
                Recommended Actions:
                  - Smoke test the intake for vacuum leaks
                  - Clean or replace the MAF sensor
                  - Check fuel pressure
                """, text);
    }

    @Test
    void formatRecord_ShouldLoadBackAsCorpus() {
        StringBuilder exported = new StringBuilder();
        for (CodeRecord record : engine.store().all()) {
            exported.append(formatter.formatRecord(record)).append('\n');
        }

        RecordStore reloaded = TestCorpus.store(exported.toString());

        assertEquals(engine.store().all(), reloaded.all());
    }

    @Test
    void formatRecords_ShouldReportCountOrEmpty() {
        String found = formatter.formatRecords("severity=High", engine.filter(FilterCriteria.bySeverity(Severity.HIGH)));

        assertTrue(found.startsWith("Found 1 errors for severity=High\n\nError Code: P0300\n"));
        assertEquals("No errors found for system=Lighting\n", formatter.formatRecords("system=Lighting", List.of()));
    }

    @Test
    void formatSearch_ShouldPrefixEachHitWithScore() {
        String text = formatter.formatSearch("misfire", engine.search("misfire"));

        assertTrue(text.startsWith("Found 1 errors containing keyword: misfire\n\n# 1. score 3.00, matched: misfire\n"));
        assertEquals("No errors found containing keyword: warp drive\n",
                formatter.formatSearch("warp drive", List.of()));
    }
}
