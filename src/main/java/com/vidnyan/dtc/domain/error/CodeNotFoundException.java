package com.vidnyan.dtc.domain.error;

import lombok.Getter;

@Getter
public class CodeNotFoundException extends DiagnosticException {

    private final String code;

    public CodeNotFoundException(String code) {
        super("Error code '" + code + "' not found in database");
        this.code = code;
    }
}
