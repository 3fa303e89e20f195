package com.vidnyan.dtc.application.service;

import com.vidnyan.dtc.DtcProperties;
import com.vidnyan.dtc.application.port.in.CodeQueryUseCase;
import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.query.FilterCriteria;
import com.vidnyan.dtc.domain.query.QueryEngine;
import com.vidnyan.dtc.domain.query.SearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application service behind the CLI.
 * Each call reads from exactly one published snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeQueryService implements CodeQueryUseCase {

    private final CodeDatabaseHolder databaseHolder;
    private final Explainer explainer;
    private final DtcProperties properties;

    @Override
    public CodeRecord lookup(String code) {
        log.debug("Lookup {}", code);
        return databaseHolder.current().lookupByCode(code);
    }

    @Override
    public List<CodeRecord> filter(FilterCriteria criteria) {
        return databaseHolder.current().filter(criteria);
    }

    @Override
    public List<SearchHit> search(String query) {
        List<SearchHit> hits = databaseHolder.current().search(query);
        int limit = properties.getSearch().getMaxResults();
        if (limit > 0 && hits.size() > limit) {
            log.debug("Truncating {} search hits to {}", hits.size(), limit);
            return hits.subList(0, limit);
        }
        return hits;
    }

    @Override
    public Explainer.Explanation explain(String code) {
        CodeRecord record = lookup(code);
        return explainer.explain(record);
    }

    @Override
    public List<String> systems() {
        return databaseHolder.current().systems();
    }

    @Override
    public QueryEngine.CorpusStats stats() {
        return databaseHolder.current().stats();
    }

    @Override
    public QueryEngine.CorpusStats reload() {
        return databaseHolder.reload().stats();
    }
}
