package com.vidnyan.dtc;

import com.vidnyan.dtc.application.port.in.CodeQueryUseCase;
import com.vidnyan.dtc.domain.error.CorpusLoadException;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.model.Severity;
import com.vidnyan.dtc.domain.query.FilterCriteria;
import com.vidnyan.dtc.domain.query.QueryEngine;
import com.vidnyan.dtc.domain.query.SearchHit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "dtc.cli.enabled=false")
class DtcApplicationTests {

    @Autowired
    private CodeQueryUseCase queries;

    @Test
    void bundledCorpusShouldLoad() {
        QueryEngine.CorpusStats stats = queries.stats();

        assertEquals(29, stats.totalRecords());
        assertTrue(stats.systems().contains("Engine"));
    }

    @Test
    void lookupShouldServeP0300() {
        CodeRecord record = queries.lookup("p0300");

        assertEquals("Random/Multiple Cylinder Misfire Detected", record.description());
        assertEquals(Severity.HIGH, record.severity());
        assertEquals("Engine", record.system());
        assertEquals(5, record.possibleCauses().size());
    }

    @Test
    void filterAndSearchShouldWork() {
        List<CodeRecord> network = queries.filter(FilterCriteria.bySystem("network"));
        List<SearchHit> misfire = queries.search("misfire");

        assertEquals(List.of("U0100", "U0101", "U0121", "U0155"), network.stream().map(CodeRecord::code).toList());
        assertEquals("P0300", misfire.get(0).record().code());
    }

    @Test
    void invalidCorpusShouldFailStartup() {
        SpringApplicationBuilder builder = new SpringApplicationBuilder(DtcApplication.class);

        // command line arguments outrank application.properties
        RuntimeException failure = assertThrows(RuntimeException.class, () -> builder.run(
                "--dtc.cli.enabled=false",
                "--dtc.corpus.location=classpath:corpus/duplicate.txt"));

        CorpusLoadException cause = CorpusLoadException.findIn(failure);
        assertNotNull(cause);
        assertEquals(6, cause.getLine());
        assertTrue(cause.getReason().startsWith("duplicate code P0300"));
    }
}
