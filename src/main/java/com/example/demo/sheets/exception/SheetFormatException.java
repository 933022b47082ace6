package com.example.demo.sheets.exception;

/**
 * Thrown for worksheet or manifest content that cannot be parsed or violates
 * the declared table shape.
 */
public class SheetFormatException extends SpreadsheetException {

    public SheetFormatException(String message) {
        super(message);
    }

    public SheetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
