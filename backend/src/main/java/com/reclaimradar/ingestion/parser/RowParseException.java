package com.reclaimradar.ingestion.parser;

import lombok.Getter;

/**
 * A report row that cannot be mapped: required field missing, unparseable date or number, wrong field count.
 * Caught per row by the stores and counted as skipped.
 */
@Getter
public class RowParseException extends RuntimeException {

    private final int lineNumber;

    public RowParseException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public RowParseException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }
}
