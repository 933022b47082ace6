package com.example.demo.sheets.exception;

import lombok.Getter;

/**
 * Thrown when a required stream is absent from the package.
 */
@Getter
public class MissingEntryException extends SpreadsheetException {

    private final String entryName;

    public MissingEntryException(String entryName) {
        super("Entry not found in package: " + entryName);
        this.entryName = entryName;
    }
}
