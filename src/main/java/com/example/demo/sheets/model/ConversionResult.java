package com.example.demo.sheets.model;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class ConversionResult {

    private final Path source;
    private int sheetCount;
    private final List<Path> writtenFiles = new ArrayList<>();

    public void addWrittenFile(Path file) {
        writtenFiles.add(file);
    }
}
