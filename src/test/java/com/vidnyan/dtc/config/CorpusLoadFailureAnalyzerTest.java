package com.vidnyan.dtc.config;

import com.vidnyan.dtc.domain.error.CorpusLoadException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.diagnostics.FailureAnalysis;

import static org.junit.jupiter.api.Assertions.*;

class CorpusLoadFailureAnalyzerTest {

    private final CorpusLoadFailureAnalyzer analyzer = new CorpusLoadFailureAnalyzer();

    @Test
    void analyze_ShouldReportLineAndReason() {
        CorpusLoadException cause = new CorpusLoadException(12, "empty description for P0300");

        FailureAnalysis analysis = analyzer.analyze(new BeanCreationException("codeDatabaseHolder", "init failed", cause));

        assertNotNull(analysis);
        assertEquals("The diagnostic code corpus could not be loaded at line 12: empty description for P0300",
                analysis.getDescription());
        assertTrue(analysis.getAction().contains("dtc.corpus.location"));
        assertSame(cause, analysis.getCause());
    }

    @Test
    void analyze_UnreadableSourceShouldOmitLine() {
        FailureAnalysis analysis = analyzer.analyze(new CorpusLoadException(0, "corpus not found at /nowhere.txt"));

        assertEquals("The diagnostic code corpus could not be loaded while reading the source: corpus not found at /nowhere.txt",
                analysis.getDescription());
    }

    @Test
    void analyze_ShouldIgnoreOtherFailures() {
        assertNull(analyzer.analyze(new IllegalStateException("unrelated")));
    }
}
