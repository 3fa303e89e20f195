package com.vidnyan.dtc.domain.error;

import lombok.Getter;

/**
 * The corpus could not be loaded. No partial store is ever built.
 * {@code line} is 1-based, or 0 when the failure is not tied to a line (unreadable source).
 */
@Getter
public class CorpusLoadException extends DiagnosticException {

    private final int line;
    private final String reason;

    public CorpusLoadException(int line, String reason) {
        super(format(line, reason));
        this.line = line;
        this.reason = reason;
    }

    public CorpusLoadException(int line, String reason, Throwable cause) {
        super(format(line, reason), cause);
        this.line = line;
        this.reason = reason;
    }

    /**
     * Find a load failure in a cause chain, e.g. under a bean creation exception.
     */
    public static CorpusLoadException findIn(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof CorpusLoadException loadException) {
                return loadException;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String format(int line, String reason) {
        return line > 0 ? "line " + line + ": " + reason : reason;
    }
}
