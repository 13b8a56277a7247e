package com.spreadsheet.formula.exceptions;

/**
 * Base type for every error the formula engine can raise.
 * Each subtype carries a stable code, used by the HTTP layer
 * and in log output. All of them abort the current run.
 */
public abstract class SpreadsheetException extends RuntimeException {

    protected SpreadsheetException(String message) {
        super(message);
    }

    protected SpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
