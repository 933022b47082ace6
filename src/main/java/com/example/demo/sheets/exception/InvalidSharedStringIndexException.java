package com.example.demo.sheets.exception;

import lombok.Getter;

/**
 * Thrown when a shared-string cell points outside the shared-string table.
 */
@Getter
public class InvalidSharedStringIndexException extends SpreadsheetException {

    private final String cellReference;
    private final String rawIndex;

    public InvalidSharedStringIndexException(String cellReference, String rawIndex, int tableSize) {
        super("Cell " + cellReference + " references shared string '" + rawIndex
                + "' but the table holds " + tableSize + " entries");
        this.cellReference = cellReference;
        this.rawIndex = rawIndex;
    }
}
