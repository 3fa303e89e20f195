package com.vidnyan.dtc.adapter.in.cli;

import com.vidnyan.dtc.application.port.in.CodeQueryUseCase;
import com.vidnyan.dtc.domain.error.DiagnosticException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-eval loop over standard input. Failed commands print a message and the loop continues.
 */
@Slf4j
class InteractiveSession {

    private final CliCommandExecutor executor;
    private final CodeQueryUseCase queries;
    private final PrintStream out;

    InteractiveSession(CliCommandExecutor executor, CodeQueryUseCase queries, PrintStream out) {
        this.executor = executor;
        this.queries = queries;
        this.out = out;
    }

    ExitStatus run(BufferedReader in) {
        out.println("=== Car Diagnostic Tool Interactive Mode ===");
        out.println("Type 'help' for available commands or 'exit' to quit");

        try {
            String line;
            while (true) {
                out.print("> ");
                out.flush();
                line = in.readLine();
                if (line == null) {
                    break;
                }
                String input = line.trim();
                if (input.isEmpty()) {
                    continue;
                }
                if (!handle(input)) {
                    break;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read interactive input", e);
        }

        out.println("Exiting interactive mode");
        return ExitStatus.OK;
    }

    /**
     * @return false when the session should end
     */
    private boolean handle(String input) {
        String[] parts = input.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String rest = parts.length > 1 ? parts[1].trim() : "";

        try {
            switch (command) {
                case "exit", "quit" -> {
                    return false;
                }
                case "help" -> printHelp();
                case "lookup" -> requireArgument(command, rest, "<code>",
                        () -> executor.lookup(args(List.of(rest), Map.of())));
                case "system" -> requireArgument(command, rest, "<system_name>",
                        () -> executor.list(args(List.of(), Map.of("system", rest))));
                case "severity" -> requireArgument(command, rest, "<level>",
                        () -> executor.list(args(List.of(), Map.of("severity", rest))));
                case "search" -> requireArgument(command, rest, "<keyword>",
                        () -> executor.search(args(Arrays.asList(rest.split("\\s+")), Map.of())));
                case "explain" -> requireArgument(command, rest, "<code>",
                        () -> executor.explain(args(List.of(rest), Map.of())));
                case "info" -> executor.info();
                case "reload" -> executor.reload();
                default -> out.println("Unknown command. Type 'help' for available commands.");
            }
        } catch (DiagnosticException e) {
            log.debug("Interactive command '{}' failed: {}", input, e.getMessage());
            out.println(e.getMessage());
        }
        return true;
    }

    private void requireArgument(String command, String rest, String placeholder, Runnable action) {
        if (rest.isEmpty()) {
            out.println("Usage: " + command + " " + placeholder);
            return;
        }
        action.run();
    }

    private CliArguments args(List<String> positional, Map<String, String> options) {
        return new CliArguments(null, positional, options);
    }

    private void printHelp() {
        out.println("Available commands:");
        out.println("  lookup <code>          - Look up details for an error code");
        out.println("  system <system_name>   - List all errors for a specific system");
        out.println("  severity <level>       - List all errors with a specific severity");
        out.println("  search <keyword>       - Search for errors containing keywords");
        out.println("  explain <code>         - Explain an error code in plain language");
        out.println("  info                   - Show database statistics");
        out.println("  reload                 - Reload the error code database");
        out.println("  help                   - Display this help message");
        out.println("  exit                   - Exit the interactive mode");
        out.println("Known systems: " + String.join(", ", queries.systems()));
    }
}
