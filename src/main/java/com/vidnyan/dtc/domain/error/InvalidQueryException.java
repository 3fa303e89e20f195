package com.vidnyan.dtc.domain.error;

import lombok.Getter;

@Getter
public class InvalidQueryException extends DiagnosticException {

    private final String reason;

    public InvalidQueryException(String reason) {
        super("Invalid query: " + reason);
        this.reason = reason;
    }
}
