package com.vidnyan.dtc.domain.query;

import com.vidnyan.dtc.domain.model.CodeRecord;

import java.util.Comparator;
import java.util.List;

/**
 * A keyword search result: the record plus its relevance score.
 */
public record SearchHit(
    CodeRecord record,
    double score,
    List<String> matchedTokens
) {

    /** Descending score, ties broken by ascending code. */
    public static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparing(hit -> hit.record().code());

    public SearchHit {
        matchedTokens = List.copyOf(matchedTokens);
    }
}
