package com.vidnyan.dtc.adapter.out.format;

import com.vidnyan.dtc.TestCorpus;
import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.query.QueryEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HtmlResultFormatterTest {

    private final HtmlResultFormatter formatter = new HtmlResultFormatter();

    @Test
    void formatRecord_ShouldProduceStandaloneDocument() {
        QueryEngine engine = TestCorpus.sampleEngine();

        String html = formatter.formatRecord(engine.lookupByCode("P0300"));

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<title>Car Error Code Report</title>"));
        assertTrue(html.contains("<h2>Error Code: P0300</h2>"));
        assertTrue(html.contains("<li>Spark plug issues</li>"));
        assertTrue(html.trim().endsWith("</html>"));
    }

    @Test
    void formatRecords_ShouldEscapeCorpusText() {
        String corpus = TestCorpus.block("B1000", "Module <ECU> & \"gateway\" fault", "Medium", "Body",
                List.of("Water in <connector>"), List.of("Reflash"));
        QueryEngine engine = TestCorpus.engine(corpus);

        String html = formatter.formatRecords("system=<Body>", engine.store().all());

        assertTrue(html.contains("Module &lt;ECU&gt; &amp; &quot;gateway&quot; fault"));
        assertTrue(html.contains("<li>Water in &lt;connector&gt;</li>"));
        assertTrue(html.contains("Found 1 errors for system=&lt;Body&gt;"));
        assertFalse(html.contains("<ECU>"));
    }

    @Test
    void formatSearch_ShouldIncludeRelevance() {
        QueryEngine engine = TestCorpus.sampleEngine();

        String html = formatter.formatSearch("vacuum", engine.search("vacuum"));

        assertTrue(html.contains("Found 2 errors containing keyword: vacuum"));
        assertTrue(html.contains("Relevance 2.00 (matched: vacuum)"));
    }

    @Test
    void formatExplanation_ShouldSplitParagraphs() {
        String html = formatter.formatExplanation(
                new Explainer.Explanation("P0300", "First part.\n\nSecond <part>.", "template"));

        assertTrue(html.contains("<p>First part.</p>"));
        assertTrue(html.contains("<p>Second &lt;part&gt;.</p>"));
        assertTrue(html.contains("Source: template"));
    }

    @Test
    void escape_ShouldHandleNullAndQuotes() {
        assertEquals("", HtmlResultFormatter.escape(null));
        assertEquals("it&#39;s", HtmlResultFormatter.escape("it's"));
    }
}
