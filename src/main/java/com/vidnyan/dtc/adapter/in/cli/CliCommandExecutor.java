package com.vidnyan.dtc.adapter.in.cli;

import com.vidnyan.dtc.adapter.out.format.ResultFormatters;
import com.vidnyan.dtc.application.port.in.CodeQueryUseCase;
import com.vidnyan.dtc.application.port.out.OutputFormat;
import com.vidnyan.dtc.application.port.out.ResultFormatter;
import com.vidnyan.dtc.domain.error.CodeNotFoundException;
import com.vidnyan.dtc.domain.error.CorpusLoadException;
import com.vidnyan.dtc.domain.error.InvalidQueryException;
import com.vidnyan.dtc.domain.model.CodeCategory;
import com.vidnyan.dtc.domain.model.CodeRecord;
import com.vidnyan.dtc.domain.model.Severity;
import com.vidnyan.dtc.domain.query.FilterCriteria;
import com.vidnyan.dtc.domain.query.QueryEngine;
import com.vidnyan.dtc.domain.query.SearchHit;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Executes one CLI command against the query use case and renders the result.
 * Expected failures are printed as one-line messages and mapped to an {@link ExitStatus}.
 */
@Slf4j
public class CliCommandExecutor {

    private final CodeQueryUseCase queries;
    private final ResultFormatters formatters;
    private final PrintStream out;
    private final PrintStream err;

    public CliCommandExecutor(CodeQueryUseCase queries, ResultFormatters formatters, PrintStream out, PrintStream err) {
        this.queries = queries;
        this.formatters = formatters;
        this.out = out;
        this.err = err;
    }

    public ExitStatus execute(List<String> args, BufferedReader in) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return ExitStatus.USAGE;
        }

        if (arguments.command() == null) {
            printUsage(err);
            return ExitStatus.USAGE;
        }

        try {
            return switch (arguments.command()) {
                case "lookup" -> lookup(arguments);
                case "list" -> list(arguments);
                case "search" -> search(arguments);
                case "explain" -> explain(arguments);
                case "info" -> info();
                case "interactive" -> new InteractiveSession(this, queries, out).run(in);
                case "help" -> {
                    printUsage(out);
                    yield ExitStatus.OK;
                }
                default -> {
                    err.println("Unknown command: " + arguments.command());
                    printUsage(err);
                    yield ExitStatus.USAGE;
                }
            };
        } catch (CodeNotFoundException e) {
            log.debug("Not found: {}", e.getCode());
            err.println(e.getMessage());
            return ExitStatus.NOT_FOUND;
        } catch (InvalidQueryException e) {
            log.debug("Invalid query: {}", e.getReason());
            err.println(e.getMessage());
            return ExitStatus.INVALID_QUERY;
        } catch (CorpusLoadException e) {
            log.error("Corpus load failed: {}", e.getMessage());
            err.println("Failed to load corpus: " + e.getMessage());
            return ExitStatus.LOAD_FAILURE;
        }
    }

    ExitStatus lookup(CliArguments arguments) {
        String code = arguments.firstPositional().orElse(null);
        if (code == null) {
            err.println("Usage: lookup <code> [--format text|html|json] [--output <path>]");
            return ExitStatus.USAGE;
        }
        CodeRecord record = queries.lookup(code);
        return emit(arguments, formatter -> formatter.formatRecord(record));
    }

    ExitStatus list(CliArguments arguments) {
        String system = arguments.option("system").orElse(null);
        Severity severity = arguments.option("severity")
                .map(value -> Severity.parse(value).orElseThrow(() -> new InvalidQueryException(
                        "unrecognized severity '" + value + "' (expected Low, Medium, High or Critical)")))
                .orElse(null);
        CodeCategory category = arguments.option("category")
                .map(value -> CodeCategory.parse(value).orElseThrow(() -> new InvalidQueryException(
                        "unrecognized category '" + value + "' (expected P, C, B or U)")))
                .orElse(null);

        FilterCriteria criteria = new FilterCriteria(system, severity, category);
        if (criteria.isEmpty()) {
            err.println("Usage: list --system <name> | --severity <level> [--category <P|C|B|U>]");
            err.println("Known systems: " + String.join(", ", queries.systems()));
        }
        List<CodeRecord> records = queries.filter(criteria);
        return emit(arguments, formatter -> formatter.formatRecords(criteria.describe(), records));
    }

    ExitStatus search(CliArguments arguments) {
        String query = arguments.joinedPositional();
        if (query.isBlank()) {
            err.println("Usage: search \"<keywords>\"");
            return ExitStatus.USAGE;
        }
        List<SearchHit> hits = queries.search(query);
        return emit(arguments, formatter -> formatter.formatSearch(query, hits));
    }

    ExitStatus explain(CliArguments arguments) {
        String code = arguments.firstPositional().orElse(null);
        if (code == null) {
            err.println("Usage: explain <code> [--format text|html|json] [--output <path>]");
            return ExitStatus.USAGE;
        }
        var explanation = queries.explain(code);
        return emit(arguments, formatter -> formatter.formatExplanation(explanation));
    }

    ExitStatus info() {
        QueryEngine.CorpusStats stats = queries.stats();
        out.println("Error codes: " + stats.totalRecords());
        out.println("Distinct keywords: " + stats.distinctTokens());
        out.println("By severity:");
        for (Map.Entry<Severity, Integer> entry : stats.bySeverity().entrySet()) {
            out.printf("  %-9s %d%n", entry.getKey().label(), entry.getValue());
        }
        out.println("By category:");
        for (Map.Entry<CodeCategory, Integer> entry : stats.byCategory().entrySet()) {
            out.printf("  %s %-10s %d%n", entry.getKey().prefix(), entry.getKey().name(), entry.getValue());
        }
        out.println("Systems: " + String.join(", ", stats.systems()));
        return ExitStatus.OK;
    }

    ExitStatus reload() {
        QueryEngine.CorpusStats stats = queries.reload();
        out.println("Reloaded " + stats.totalRecords() + " error codes");
        return ExitStatus.OK;
    }

    private ExitStatus emit(CliArguments arguments, Rendering rendering) {
        String outputPath = arguments.option("output").orElse(null);
        OutputFormat format;
        if (arguments.option("format").isPresent()) {
            String value = arguments.option("format").get();
            format = OutputFormat.parse(value).orElse(null);
            if (format == null) {
                err.println("Unknown format '" + value + "' (expected text, html or json)");
                return ExitStatus.USAGE;
            }
        } else {
            format = outputPath != null ? OutputFormat.forFileName(outputPath) : OutputFormat.TEXT;
        }

        String rendered = rendering.render(formatters.get(format));
        if (outputPath == null) {
            out.print(rendered);
            out.flush();
            return ExitStatus.OK;
        }

        try {
            Path path = Path.of(outputPath);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, rendered, StandardCharsets.UTF_8);
            out.println("Report exported to " + outputPath);
            return ExitStatus.OK;
        } catch (IOException e) {
            log.error("Failed to write {}", outputPath, e);
            err.println("Failed to export report: " + e.getMessage());
            return ExitStatus.IO_FAILURE;
        }
    }

    void printUsage(PrintStream stream) {
        stream.println("Usage:");
        stream.println("  lookup <code> [--format text|html|json] [--output <path>]");
        stream.println("  list --system <name> | --severity <level> [--category <P|C|B|U>] [--format ...] [--output ...]");
        stream.println("  search \"<keywords>\" [--format ...] [--output ...]");
        stream.println("  explain <code> [--format ...] [--output ...]");
        stream.println("  info");
        stream.println("  interactive");
        stream.println("  help");
    }

    @FunctionalInterface
    private interface Rendering {
        String render(ResultFormatter formatter);
    }
}
