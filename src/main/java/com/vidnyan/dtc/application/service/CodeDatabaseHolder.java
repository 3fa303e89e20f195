package com.vidnyan.dtc.application.service;

import com.vidnyan.dtc.application.port.out.CorpusSource;
import com.vidnyan.dtc.domain.index.IndexBuilder;
import com.vidnyan.dtc.domain.index.Indices;
import com.vidnyan.dtc.domain.model.CorpusEntry;
import com.vidnyan.dtc.domain.model.RecordStore;
import com.vidnyan.dtc.domain.model.SystemCatalog;
import com.vidnyan.dtc.domain.query.QueryEngine;
import com.vidnyan.dtc.domain.query.SearchScorer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the published query snapshot (store + indices).
 * A snapshot is built completely before a single reference swap makes it visible,
 * so readers never observe a partially built index.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeDatabaseHolder {

    private final CorpusSource corpusSource;
    private final SystemCatalog systemCatalog;
    private final SearchScorer searchScorer;

    private final AtomicReference<QueryEngine> current = new AtomicReference<>();

    /**
     * Initial load. A failure here aborts application startup.
     */
    @PostConstruct
    public void load() {
        reload();
    }

    /**
     * Parse, validate and index the corpus, then publish it.
     *
     * @throws com.vidnyan.dtc.domain.error.CorpusLoadException on any invalid record; the previous snapshot is kept
     */
    public QueryEngine reload() {
        Instant start = Instant.now();
        log.info("Loading code corpus from {}", corpusSource.describe());

        List<CorpusEntry> entries = corpusSource.readEntries();
        RecordStore store = RecordStore.load(entries, systemCatalog);
        Indices indices = IndexBuilder.build(store);
        QueryEngine engine = new QueryEngine(store, indices, searchScorer);

        current.set(engine);
        log.info("Loaded {} error codes ({} systems, {} tokens) in {}ms",
                store.size(),
                indices.systemKeys().size(),
                indices.tokens().size(),
                Duration.between(start, Instant.now()).toMillis());
        return engine;
    }

    /**
     * The snapshot to use for one query.
     */
    public QueryEngine current() {
        QueryEngine engine = current.get();
        if (engine == null) {
            throw new IllegalStateException("Code database has not been loaded");
        }
        return engine;
    }
}
