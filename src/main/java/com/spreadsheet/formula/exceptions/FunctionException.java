package com.spreadsheet.formula.exceptions;

/**
 * Thrown for calls to unknown functions, calls with the wrong number
 * of arguments, or arguments a function cannot accept.
 */
public class FunctionException extends SpreadsheetException {

    private final String functionName;

    public FunctionException(String functionName, String message) {
        super(message);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    @Override
    public String getCode() {
        return "FUNCTION_ERROR";
    }
}
