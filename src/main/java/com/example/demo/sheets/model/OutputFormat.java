package com.example.demo.sheets.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of output formats a sheet can be written as.
 */
public enum OutputFormat {

    CSV("csv"),
    JSON("json"),
    YAML("yaml");

    private static final Map<String, OutputFormat> BY_TAG = new HashMap<>();

    static {
        for (OutputFormat format : values()) {
            BY_TAG.put(format.tag, format);
        }
    }

    private final String tag;

    OutputFormat(String tag) {
        this.tag = tag;
    }

    /**
     * Command-line flag name and file extension.
     */
    public String getTag() {
        return tag;
    }

    public String getExtension() {
        return tag;
    }

    public static Optional<OutputFormat> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag.toLowerCase(Locale.ROOT)));
    }

    public static String tags() {
        return String.join(", ", Arrays.stream(values()).map(OutputFormat::getTag).toArray(String[]::new));
    }
}
