package com.vidnyan.dtc.application.port.in;

import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.query.FilterCriteria;
import com.vidnyan.dtc.domain.query.QueryEngine;
import com.vidnyan.dtc.domain.query.SearchHit;

import java.util.List;

/**
 * Primary use case: query the diagnostic code reference.
 * Not-found and invalid queries surface as
 * {@link com.vidnyan.dtc.domain.error.CodeNotFoundException} and
 * {@link com.vidnyan.dtc.domain.error.InvalidQueryException}.
 */
public interface CodeQueryUseCase {

    /**
     * Look up one code, case-insensitively.
     */
    CodeRecord lookup(String code);

    /**
     * List records by system, severity and/or category, ordered by code.
     */
    List<CodeRecord> filter(FilterCriteria criteria);

    /**
     * Keyword search, best match first.
     */
    List<SearchHit> search(String query);

    /**
     * Plain-language explanation of a code.
     */
    Explainer.Explanation explain(String code);

    List<String> systems();

    QueryEngine.CorpusStats stats();

    /**
     * Re-read and re-index the corpus. The previous snapshot stays active if this fails.
     */
    QueryEngine.CorpusStats reload();
}
