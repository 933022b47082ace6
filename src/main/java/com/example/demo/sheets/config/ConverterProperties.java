package com.example.demo.sheets.config;

import com.example.demo.sheets.model.OutputFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converter defaults, bound from {@code application.yml}.
 *
 * Example application.yml:
 *
 * sheet-happens:
 *   sanitize: true
 *   output-directory: /tmp/exports
 *   json-indent: 4
 *   formats:
 *     - csv
 *
 * Command-line flags take precedence over these values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "sheet-happens")
public class ConverterProperties {

    /**
     * Trim cell values and fold line breaks into single spaces
     */
    private boolean sanitize = true;

    /**
     * Where output files go when no --output flag is given (default: next to the source file)
     */
    private String outputDirectory;

    /**
     * Spaces per indentation level of the JSON output
     */
    private int jsonIndent = 4;

    /**
     * Formats written when the command line selects none
     */
    private List<OutputFormat> formats = new ArrayList<>();
}
