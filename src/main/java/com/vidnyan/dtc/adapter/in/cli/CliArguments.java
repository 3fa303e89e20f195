package com.vidnyan.dtc.adapter.in.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line: a command, positional arguments and {@code --name value} options.
 * Options whose name contains a dot ({@code --dtc.corpus.location=...}) are Spring
 * properties and are skipped, as are {@code --debug} and {@code --trace}.
 */
public record CliArguments(
    String command,
    List<String> positional,
    Map<String, String> options
) {

    static final Set<String> VALUE_OPTIONS = Set.of("format", "output", "system", "severity", "category");

    /** Spring Boot switches that may appear on the same command line. */
    static final Set<String> SPRING_FLAGS = Set.of("debug", "trace");

    public static CliArguments parse(List<String> args) {
        String command = null;
        List<String> positional = new ArrayList<>();
        Map<String, String> options = new HashMap<>();

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.startsWith("--")) {
                String name = arg.substring(2);
                String value = null;
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    value = name.substring(eq + 1);
                    name = name.substring(0, eq);
                }
                if (name.contains(".") || SPRING_FLAGS.contains(name)) {
                    continue;
                }
                name = name.toLowerCase(Locale.ROOT);
                if (!VALUE_OPTIONS.contains(name)) {
                    throw new IllegalArgumentException("Unknown option --" + name);
                }
                if (value == null) {
                    if (i + 1 >= args.size()) {
                        throw new IllegalArgumentException("Option --" + name + " requires a value");
                    }
                    value = args.get(++i);
                }
                options.put(name, value);
            } else if (command == null) {
                command = arg.toLowerCase(Locale.ROOT);
            } else {
                positional.add(arg);
            }
        }
        return new CliArguments(command, List.copyOf(positional), Map.copyOf(options));
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public Optional<String> firstPositional() {
        return positional.isEmpty() ? Optional.empty() : Optional.of(positional.get(0));
    }

    /**
     * Positionals joined by spaces, for unquoted multi-word search terms.
     */
    public String joinedPositional() {
        return String.join(" ", positional);
    }
}
