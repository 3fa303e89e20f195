package com.vidnyan.dtc.application.port.out;

import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.query.SearchHit;

import java.util.List;

/**
 * Port for rendering query results. Implementations must preserve result order.
 */
public interface ResultFormatter {

    OutputFormat format();

    String formatRecord(CodeRecord record);

    /**
     * Render a filter result.
     *
     * @param title short description of the query, e.g. {@code severity=High}
     */
    String formatRecords(String title, List<CodeRecord> records);

    String formatSearch(String query, List<SearchHit> hits);

    String formatExplanation(Explainer.Explanation explanation);
}
