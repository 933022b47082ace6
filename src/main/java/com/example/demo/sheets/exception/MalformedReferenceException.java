package com.example.demo.sheets.exception;

import lombok.Getter;

@Getter
public class MalformedReferenceException extends SpreadsheetException {

    private final String reference;

    public MalformedReferenceException(String reference, String reason) {
        super("Malformed cell reference '" + reference + "': " + reason);
        this.reference = reference;
    }
}
