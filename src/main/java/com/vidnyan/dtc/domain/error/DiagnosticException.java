package com.vidnyan.dtc.domain.error;

/**
 * Base type for the expected failure outcomes of loading and querying the code database.
 */
public abstract class DiagnosticException extends RuntimeException {

    protected DiagnosticException(String message) {
        super(message);
    }

    protected DiagnosticException(String message, Throwable cause) {
        super(message, cause);
    }
}
