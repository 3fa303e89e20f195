package com.vidnyan.dtc.adapter.out.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.application.port.out.OutputFormat;
import com.vidnyan.dtc.application.port.out.ResultFormatter;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.query.SearchHit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON output. Field names are stable; result arrays keep query order.
 */
@Component
@RequiredArgsConstructor
public class JsonResultFormatter implements ResultFormatter {

    private final ObjectMapper objectMapper;

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String formatRecord(CodeRecord record) {
        return write(RecordView.of(record));
    }

    @Override
    public String formatRecords(String title, List<CodeRecord> records) {
        return write(new ListView(title, records.size(), records.stream().map(RecordView::of).toList()));
    }

    @Override
    public String formatSearch(String query, List<SearchHit> hits) {
        List<HitView> views = hits.stream()
                .map(hit -> new HitView(hit.score(), hit.matchedTokens(), RecordView.of(hit.record())))
                .toList();
        return write(new SearchView(query, views.size(), views));
    }

    @Override
    public String formatExplanation(Explainer.Explanation explanation) {
        return write(explanation);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render JSON", e);
        }
    }

    record RecordView(
        String code,
        String description,
        String severity,
        String system,
        String category,
        List<String> possibleCauses,
        List<String> recommendedActions
    ) {
        static RecordView of(CodeRecord record) {
            return new RecordView(
                    record.code(),
                    record.description(),
                    record.severity().label(),
                    record.system(),
                    record.category().name(),
                    record.possibleCauses(),
                    record.recommendedActions());
        }
    }

    record ListView(String query, int count, List<RecordView> results) {}

    record HitView(double score, List<String> matchedTokens, RecordView record) {}

    record SearchView(String query, int count, List<HitView> results) {}
}
