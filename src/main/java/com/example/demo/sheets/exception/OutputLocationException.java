package com.example.demo.sheets.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Thrown when the output directory cannot be prepared.
 */
@Getter
public class OutputLocationException extends SpreadsheetException {

    private final Path location;

    public OutputLocationException(Path location, String reason) {
        super("Cannot use output location " + location + ": " + reason);
        this.location = location;
    }

    public OutputLocationException(Path location, Throwable cause) {
        super("Cannot create output location " + location, cause);
        this.location = location;
    }
}
