package com.vidnyan.dtc.adapter.out.ai;

import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.model.CodeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Offline explainer that builds a plain-language summary from the record itself.
 * Deterministic; also the fallback when a remote explainer fails.
 */
@Slf4j
public class TemplateExplainer implements Explainer {

    static final String PROVIDER = "template";

    @Override
    public Explanation explain(CodeRecord record) {
        log.debug("Template explanation for {}", record.code());

        StringBuilder text = new StringBuilder();
        text.append(String.format("%s (%s) means: %s. It is reported by the %s system.",
                record.code(),
                categoryName(record),
                record.description(),
                record.system()));
        text.append("\n\n").append(urgency(record));

        if (!record.possibleCauses().isEmpty()) {
            text.append("\n\nThe most likely causes are ")
                    .append(joinNatural(record.possibleCauses()))
                    .append('.');
        }
        if (!record.recommendedActions().isEmpty()) {
            text.append("\n\nStart with: ")
                    .append(record.recommendedActions().get(0));
            if (record.recommendedActions().size() > 1) {
                text.append(", then ").append(joinNatural(
                        record.recommendedActions().subList(1, record.recommendedActions().size())));
            }
            text.append('.');
        }
        return new Explanation(record.code(), text.toString(), PROVIDER);
    }

    private String urgency(CodeRecord record) {
        return switch (record.severity()) {
            case CRITICAL -> "This is critical: stop driving and have the vehicle inspected immediately.";
            case HIGH -> "This is a high severity fault. Have it diagnosed soon to avoid further damage.";
            case MEDIUM -> "This is a medium severity fault. Schedule a repair, but the vehicle is usually drivable.";
            case LOW -> "This is a low severity fault. It can be addressed at the next service.";
        };
    }

    private String categoryName(CodeRecord record) {
        String name = record.category().name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }

    private String joinNatural(List<String> items) {
        List<String> lowered = items.stream()
                .map(s -> s.isEmpty() ? s : Character.toLowerCase(s.charAt(0)) + s.substring(1))
                .toList();
        if (lowered.size() == 1) {
            return lowered.get(0);
        }
        return String.join(", ", lowered.subList(0, lowered.size() - 1))
                + " or " + lowered.get(lowered.size() - 1);
    }
}
