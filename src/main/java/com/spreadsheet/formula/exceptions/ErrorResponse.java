package com.spreadsheet.formula.exceptions;

/**
 * Body of every error response. For example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Cycle detected, \"A0 -> C0 -> B0 -> A0\""
 * }
 */
public class ErrorResponse {

    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorResponse of(SpreadsheetException ex) {
        return new ErrorResponse(ex.getCode(), ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
