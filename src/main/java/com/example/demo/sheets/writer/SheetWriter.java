package com.example.demo.sheets.writer;

import com.example.demo.sheets.core.Worksheet;
import com.example.demo.sheets.model.OutputFormat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes one worksheet into a file of a given format.
 */
public interface SheetWriter {

    OutputFormat getFormat();

    /**
     * Write {@code sheet} to {@code target}, replacing any existing file.
     */
    void write(Worksheet sheet, Path target) throws IOException;
}
