package com.vidnyan.dtc.adapter.out.format;

import com.vidnyan.dtc.application.port.out.OutputFormat;
import com.vidnyan.dtc.application.port.out.ResultFormatter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of formatters by output format.
 */
@Component
public class ResultFormatters {

    private final Map<OutputFormat, ResultFormatter> byFormat = new EnumMap<>(OutputFormat.class);

    public ResultFormatters(List<ResultFormatter> formatters) {
        formatters.forEach(f -> byFormat.put(f.format(), f));
    }

    public ResultFormatter get(OutputFormat format) {
        ResultFormatter formatter = byFormat.get(format);
        if (formatter == null) {
            throw new IllegalArgumentException("No formatter registered for " + format);
        }
        return formatter;
    }
}
