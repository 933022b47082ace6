package com.example.demo.sheets.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Thrown when the input file cannot be opened as a zip package.
 */
@Getter
public class NotAnArchiveException extends SpreadsheetException {

    private final Path path;

    public NotAnArchiveException(Path path, Throwable cause) {
        super("Not an Excel 2007+ package: " + path, cause);
        this.path = path;
    }
}
