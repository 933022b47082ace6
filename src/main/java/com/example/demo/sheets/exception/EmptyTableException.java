package com.example.demo.sheets.exception;

public class EmptyTableException extends SpreadsheetException {

    public EmptyTableException(String sheetName) {
        super("Sheet " + sheetName + " has no header row");
    }
}
