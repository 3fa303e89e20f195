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
 * Standalone HTML reports. All corpus text is escaped.
 */
@Component
public class HtmlResultFormatter implements ResultFormatter {

    static final String TITLE = "Car Error Code Report";

    private static final String STYLE = """
            body { font-family: Arial, sans-serif; margin: 20px; }
            .error-code { border: 1px solid #ddd; padding: 15px; margin-bottom: 20px; }
            .score { color: #777; font-size: 0.9em; }
            h2 { color: #d9534f; }
            h3 { color: #5bc0de; }
            """;

    @Override
    public OutputFormat format() {
        return OutputFormat.HTML;
    }

    @Override
    public String formatRecord(CodeRecord record) {
        return document(TITLE, recordSection(record, null));
    }

    @Override
    public String formatRecords(String title, List<CodeRecord> records) {
        StringBuilder body = new StringBuilder();
        body.append("<p>Found ").append(records.size()).append(" errors for ").append(escape(title)).append("</p>\n");
        records.forEach(record -> body.append(recordSection(record, null)));
        return document(TITLE, body.toString());
    }

    @Override
    public String formatSearch(String query, List<SearchHit> hits) {
        StringBuilder body = new StringBuilder();
        body.append("<p>Found ").append(hits.size()).append(" errors containing keyword: ")
                .append(escape(query)).append("</p>\n");
        hits.forEach(hit -> body.append(recordSection(hit.record(),
                String.format(Locale.ROOT, "Relevance %.2f (matched: %s)",
                        hit.score(), String.join(", ", hit.matchedTokens())))));
        return document(TITLE, body.toString());
    }

    @Override
    public String formatExplanation(Explainer.Explanation explanation) {
        StringBuilder body = new StringBuilder();
        body.append("<div class='error-code'>\n");
        body.append("<h2>Error Code: ").append(escape(explanation.code())).append("</h2>\n");
        for (String paragraph : explanation.text().strip().split("\\n\\s*\\n")) {
            body.append("<p>").append(escape(paragraph.strip())).append("</p>\n");
        }
        body.append("<p class='score'>Source: ").append(escape(explanation.provider())).append("</p>\n");
        body.append("</div>\n");
        return document(TITLE, body.toString());
    }

    private String recordSection(CodeRecord record, String scoreLine) {
        StringBuilder out = new StringBuilder();
        out.append("<div class='error-code'>\n");
        out.append("<h2>Error Code: ").append(escape(record.code())).append("</h2>\n");
        if (scoreLine != null) {
            out.append("<p class='score'>").append(escape(scoreLine)).append("</p>\n");
        }
        out.append("<p><strong>Description:</strong> ").append(escape(record.description())).append("</p>\n");
        out.append("<p><strong>Severity:</strong> ").append(escape(record.severity().label())).append("</p>\n");
        out.append("<p><strong>System:</strong> ").append(escape(record.system())).append("</p>\n");
        appendList(out, "Possible Causes:", record.possibleCauses());
        appendList(out, "Recommended Actions:", record.recommendedActions());
        out.append("</div>\n");
        return out.toString();
    }

    private void appendList(StringBuilder out, String heading, List<String> items) {
        out.append("<h3>").append(heading).append("</h3>\n<ul>\n");
        items.forEach(item -> out.append("<li>").append(escape(item)).append("</li>\n"));
        out.append("</ul>\n");
    }

    private String document(String title, String body) {
        return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n"
                + "<title>" + escape(title) + "</title>\n"
                + "<style>\n" + STYLE + "</style>\n"
                + "</head>\n<body>\n"
                + "<h1>" + escape(title) + "</h1>\n"
                + body
                + "</body>\n</html>\n";
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
