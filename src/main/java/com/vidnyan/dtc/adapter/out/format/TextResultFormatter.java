package com.vidnyan.dtc.adapter.out.format;

import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.application.port.out.OutputFormat;
import com.vidnyan.dtc.application.port.out.ResultFormatter;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.query.SearchHit;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text reports. A single record renders in the block corpus format,
 * so a text export can be loaded back as a corpus.
 */
@Component
public class TextResultFormatter implements ResultFormatter {

    @Override
    public OutputFormat format() {
        return OutputFormat.TEXT;
    }

    @Override
    public String formatRecord(CodeRecord record) {
        StringBuilder out = new StringBuilder();
        out.append("Error Code: ").append(record.code()).append('\n');
        out.append("Description: ").append(record.description()).append('\n');
        out.append("Severity: ").append(record.severity().label()).append('\n');
        out.append("System: ").append(record.system()).append('\n');
        out.append("Possible Causes:\n");
        record.possibleCauses().forEach(cause -> out.append("  - ").append(cause).append('\n'));
        out.append("Recommended Actions:\n");
        record.recommendedActions().forEach(action -> out.append("  - ").append(action).append('\n'));
        return out.toString();
    }

    @Override
    public String formatRecords(String title, List<CodeRecord> records) {
        if (records.isEmpty()) {
            return "No errors found for " + title + "\n";
        }
        StringBuilder out = new StringBuilder();
        out.append("Found ").append(records.size()).append(" errors for ").append(title).append("\n\n");
        for (int i = 0; i < records.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(formatRecord(records.get(i)));
        }
        return out.toString();
    }

    @Override
    public String formatSearch(String query, List<SearchHit> hits) {
        if (hits.isEmpty()) {
            return "No errors found containing keyword: " + query + "\n";
        }
        StringBuilder out = new StringBuilder();
        out.append("Found ").append(hits.size()).append(" errors containing keyword: ").append(query).append("\n\n");
        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            if (i > 0) {
                out.append('\n');
            }
            out.append(String.format(Locale.ROOT, "# %d. score %.2f, matched: %s%n",
                    i + 1, hit.score(), String.join(", ", hit.matchedTokens())));
            out.append(formatRecord(hit.record()));
        }
        return out.toString();
    }

    @Override
    public String formatExplanation(Explainer.Explanation explanation) {
        return "Explanation for " + explanation.code() + " (" + explanation.provider() + "):\n\n"
                + explanation.text().strip() + "\n";
    }
}
