package com.example.demo.sheets.writer;

import com.example.demo.sheets.core.Workbook;
import com.example.demo.sheets.core.Worksheet;
import com.example.demo.sheets.model.OutputFormat;
import com.example.demo.sheets.support.XlsxFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CsvSheetWriterTest {

    private CsvSheetWriter writer;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        writer = new CsvSheetWriter();
    }

    @Test
    public void testFormat() {
        assertEquals(OutputFormat.CSV, writer.getFormat());
    }

    @Test
    public void testWritesRowsWithCrlf() throws IOException {
        Worksheet sheet = mockSheet(
                Arrays.asList("Name", "Age"),
                Arrays.asList("Alice", "30"));
        Path target = tempDir.resolve("out.csv");

        writer.write(sheet, target);

        assertEquals("Name,Age\r\nAlice,30\r\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    public void testQuotesOnlyWhereNeeded() throws IOException {
        Worksheet sheet = mockSheet(Arrays.asList("a,b", "say \"hi\"", null, "line\nbreak", "plain", ""));
        Path target = tempDir.resolve("quoted.csv");

        writer.write(sheet, target);

        assertEquals("\"a,b\",\"say \"\"hi\"\"\",,\"line\nbreak\",plain,\r\n",
                Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    public void testUsesRowStreamNotRecords() throws IOException {
        Worksheet sheet = mockSheet(Arrays.asList("only", "header"));

        writer.write(sheet, tempDir.resolve("header.csv"));

        verify(sheet).rows();
        verify(sheet, never()).records();
        verify(sheet, never()).materialize();
    }

    @Test
    public void testKeepsNonAsciiAsUtf8() throws IOException {
        Worksheet sheet = mockSheet(Arrays.asList("Grüße", "東京"));
        Path target = tempDir.resolve("utf8.csv");

        writer.write(sheet, target);

        assertEquals("Grüße,東京\r\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    public void testSparseWorkbookKeepsEmptyRows() throws IOException {
        Path file = XlsxFixtures.workbook()
                .sharedStrings("h1", "h2")
                .worksheet(1, "A1:B3",
                        XlsxFixtures.row(1, XlsxFixtures.shared("A1", 0), XlsxFixtures.shared("B1", 1)),
                        XlsxFixtures.row(3, XlsxFixtures.number("B3", "5")))
                .writeTo(tempDir, "sparse.xlsx");
        Path target = tempDir.resolve("sparse.csv");

        try (Workbook workbook = Workbook.open(file, true)) {
            writer.write(workbook.getSheets().get(0), target);
        }

        assertEquals("h1,h2\r\n,\r\n,5\r\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @SafeVarargs
    private static Worksheet mockSheet(List<String>... rows) {
        Worksheet sheet = Mockito.mock(Worksheet.class);
        when(sheet.rows()).thenReturn(Arrays.asList(rows).iterator());
        return sheet;
    }
}
