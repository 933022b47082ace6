package com.example.demo.sheets.writer;

import com.example.demo.sheets.config.ConverterProperties;
import com.example.demo.sheets.core.Worksheet;
import com.example.demo.sheets.model.OutputFormat;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the sheet's records as a pretty-printed JSON array.
 */
@Slf4j
@Component
public class JsonSheetWriter implements SheetWriter {

    private final ObjectWriter jsonWriter;

    public JsonSheetWriter(ConverterProperties properties) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.getSerializerProvider().setNullKeySerializer(new NullKeySerializer());
        this.jsonWriter = mapper.writer(new RecordPrettyPrinter(properties.getJsonIndent()));
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public void write(Worksheet sheet, Path target) throws IOException {
        List<Map<String, String>> records = sheet.records();
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            jsonWriter.writeValue(out, records);
        }
        log.debug("Wrote {} JSON records to {}", records.size(), target);
    }

    /**
     * Indents objects and arrays by a fixed number of spaces and separates names from values with ": ".
     */
    static class RecordPrettyPrinter extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 1L;

        private final int indent;

        RecordPrettyPrinter(int indent) {
            this.indent = indent;
            DefaultIndenter indenter = new DefaultIndenter(" ".repeat(Math.max(0, indent)), "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new RecordPrettyPrinter(indent);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        // empty containers print as [] and {}
        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(g, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw(']');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (nrOfEntries > 0) {
                super.writeEndObject(g, nrOfEntries);
                return;
            }
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw('}');
        }
    }
}
