package com.example.demo.sheets.writer;

import com.example.demo.sheets.model.OutputFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup from output format to the writer handling it.
 */
@Slf4j
@Component
public class SheetWriterRegistry {

    private final Map<OutputFormat, SheetWriter> writers = new EnumMap<>(OutputFormat.class);

    public SheetWriterRegistry(List<SheetWriter> sheetWriters) {
        for (SheetWriter writer : sheetWriters) {
            SheetWriter previous = writers.put(writer.getFormat(), writer);
            if (previous != null) {
                throw new IllegalStateException("Two writers registered for " + writer.getFormat() + ": "
                        + previous.getClass().getSimpleName() + " and " + writer.getClass().getSimpleName());
            }
        }
        log.debug("Registered sheet writers for {}", writers.keySet());
    }

    public SheetWriter getWriter(OutputFormat format) {
        SheetWriter writer = writers.get(format);
        if (writer == null) {
            throw new IllegalArgumentException("No writer registered for format: " + format);
        }
        return writer;
    }

    public Set<OutputFormat> getSupportedFormats() {
        return Collections.unmodifiableSet(writers.keySet());
    }
}
