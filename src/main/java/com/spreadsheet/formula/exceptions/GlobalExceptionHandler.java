package com.spreadsheet.formula.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns engine exceptions from the controllers into error JSON
 * with an HTTP 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CellNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCellNotFound(CellNotFoundException ex) {
        return respond(ex, HttpStatus.NOT_FOUND);
    }

    // Cycles, lex/parse errors, bad literals and bad function calls are all malformed input
    @ExceptionHandler(SpreadsheetException.class)
    public ResponseEntity<ErrorResponse> handleSpreadsheetError(SpreadsheetException ex) {
        return respond(ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled error while evaluating grid", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(SpreadsheetException ex, HttpStatus status) {
        logger.debug("Rejected grid [{}]: {}", ex.getCode(), ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.of(ex), status);
    }
}
