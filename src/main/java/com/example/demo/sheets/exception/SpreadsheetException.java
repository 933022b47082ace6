package com.example.demo.sheets.exception;

/**
 * Base class for every failure raised while reading a workbook or writing its sheets.
 * Unchecked so that core iterators and writers can propagate it without wrapping.
 */
public class SpreadsheetException extends RuntimeException {

    public SpreadsheetException(String message) {
        super(message);
    }

    public SpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
