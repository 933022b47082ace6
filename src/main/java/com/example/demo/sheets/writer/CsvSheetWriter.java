package com.example.demo.sheets.writer;

import com.example.demo.sheets.core.Worksheet;
import com.example.demo.sheets.model.OutputFormat;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Writes the sheet's row stream as CSV: comma separated, quoted only where needed,
 * CRLF line ends, empty field for a missing cell.
 */
@Slf4j
@Component
public class CsvSheetWriter implements SheetWriter {

    static final String LINE_END = "\r\n";

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.CSV;
    }

    @Override
    public void write(Worksheet sheet, Path target) throws IOException {
        int count = 0;
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8),
                ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER, LINE_END)) {
            Iterator<List<String>> rows = sheet.rows();
            while (rows.hasNext()) {
                writer.writeNext(toFields(rows.next()), false);
                count++;
            }
        }
        log.debug("Wrote {} CSV rows to {}", count, target);
    }

    private static String[] toFields(List<String> row) {
        String[] fields = new String[row.size()];
        for (int i = 0; i < fields.length; i++) {
            String value = row.get(i);
            fields[i] = value == null ? "" : value;
        }
        return fields;
    }
}
