package com.vidnyan.dtc.adapter.in.cli;

/**
 * Process exit codes, one per failure outcome so scripts can branch on them.
 */
public enum ExitStatus {
    OK(0),
    USAGE(1),
    INVALID_QUERY(2),
    NOT_FOUND(3),
    LOAD_FAILURE(4),
    IO_FAILURE(5);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
