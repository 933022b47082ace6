package com.example.demo.sheets.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One conversion run: the workbook to read and the formats to write each sheet as.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRequest {

    private Path source;

    /**
     * Directory receiving the output files. Null means the directory of the source file.
     */
    private Path outputDirectory;

    @Builder.Default
    private Set<OutputFormat> formats = new LinkedHashSet<>();

    @Builder.Default
    private boolean sanitize = true;
}
