package com.vidnyan.dtc;

import com.vidnyan.dtc.adapter.out.corpus.BlockCorpusParser;
import com.vidnyan.dtc.application.port.out.CorpusSource;
import com.vidnyan.dtc.domain.index.IndexBuilder;
import com.vidnyan.dtc.domain.model.CorpusEntry;
import com.vidnyan.dtc.domain.model.RecordStore;
import com.vidnyan.dtc.domain.model.SystemCatalog;
import com.vidnyan.dtc.domain.query.FieldWeights;
import com.vidnyan.dtc.domain.query.QueryEngine;
import com.vidnyan.dtc.domain.query.TokenSumScorer;

import java.io.StringReader;
import java.util.List;

/**
 * Shared corpus fixtures for tests.
 */
public final class TestCorpus {

    /** P0300 (High, Engine) and P0171 (Medium, Fuel System); only P0300 mentions a misfire. */
    public static final String SAMPLE = """
            Error Code: P0300
            Description: Random/Multiple Cylinder Misfire Detected
            Severity: High
            System: Engine
            Possible Causes:
              - Spark plug issues
              - Ignition coil failure
              - Fuel injector problems
              - Vacuum leaks
              - Low compression
            Recommended Actions:
              - Check spark plugs and replace if necessary
              - Test ignition coils
              - Inspect fuel injectors
              - Check for vacuum leaks
              - Perform compression test

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
            """;

    private TestCorpus() {
    }

    public static List<CorpusEntry> parse(String text) {
        return new BlockCorpusParser().parse(new StringReader(text));
    }

    public static RecordStore store(String text) {
        return RecordStore.load(parse(text), SystemCatalog.open());
    }

    public static QueryEngine engine(String text) {
        RecordStore store = store(text);
        return new QueryEngine(store, IndexBuilder.build(store), new TokenSumScorer(FieldWeights.DEFAULT));
    }

    public static QueryEngine sampleEngine() {
        return engine(SAMPLE);
    }

    /**
     * Corpus source whose text can be swapped between reloads.
     */
    public static MutableSource source(String text) {
        return new MutableSource(text);
    }

    public static final class MutableSource implements CorpusSource {
        private volatile String text;
        private volatile int reads;

        private MutableSource(String text) {
            this.text = text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public int reads() {
            return reads;
        }

        @Override
        public List<CorpusEntry> readEntries() {
            reads++;
            return parse(text);
        }

        @Override
        public String describe() {
            return "in-memory test corpus";
        }
    }

    /**
     * Minimal block for one record.
     */
    public static String block(String code, String description, String severity, String system,
                               List<String> causes, List<String> actions) {
        StringBuilder sb = new StringBuilder();
        sb.append("Error Code: ").append(code).append('\n');
        sb.append("Description: ").append(description).append('\n');
        sb.append("Severity: ").append(severity).append('\n');
        sb.append("System: ").append(system).append('\n');
        sb.append("Possible Causes:\n");
        causes.forEach(c -> sb.append("  - ").append(c).append('\n'));
        sb.append("Recommended Actions:\n");
        actions.forEach(a -> sb.append("  - ").append(a).append('\n'));
        sb.append('\n');
        return sb.toString();
    }
}
