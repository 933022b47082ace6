package com.example.demo.sheets.writer;

import com.example.demo.sheets.core.Worksheet;
import com.example.demo.sheets.model.OutputFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
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
 * Writes the sheet's records as a block-style YAML sequence.
 */
@Slf4j
@Component
public class YamlSheetWriter implements SheetWriter {

    private final ObjectMapper yamlMapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build());

    public YamlSheetWriter() {
        yamlMapper.getSerializerProvider().setNullKeySerializer(new NullKeySerializer());
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.YAML;
    }

    @Override
    public void write(Worksheet sheet, Path target) throws IOException {
        List<Map<String, String>> records = sheet.records();
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            yamlMapper.writeValue(out, records);
        }
        log.debug("Wrote {} YAML records to {}", records.size(), target);
    }
}
