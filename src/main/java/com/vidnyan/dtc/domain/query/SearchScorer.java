package com.vidnyan.dtc.domain.query;

import com.vidnyan.dtc.domain.index.TokenOccurrence;

import java.util.List;
import java.util.Map;

/**
 * Scores one candidate record for a keyword query.
 * Implementations must be deterministic. Occurrence positions are available for
 * phrase or proximity aware ranking.
 */
public interface SearchScorer {

    /**
     * @param queryTokens distinct query tokens in query order
     * @param matches     for each query token present in the record, its occurrences in that record
     * @return relevance score, greater than zero when at least one token matched
     */
    double score(List<String> queryTokens, Map<String, List<TokenOccurrence>> matches);
}
