package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.SheetFormatException;
import com.example.demo.sheets.support.XlsxFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class WorkbookIndexReaderTest {

    @TempDir
    Path tempDir;

    @Test
    public void parse_mapsRelationshipNumberToNameInDeclarationOrder() {
        String xml = "<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\""
                + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\"><sheets>"
                + "<sheet name=\"Summary\" sheetId=\"4\" r:id=\"rId3\"/>"
                + "<sheet name=\"Data\" sheetId=\"1\" r:id=\"rId1\"/>"
                + "<sheet name=\"Notes\" sheetId=\"2\" r:id=\"rId2\"/>"
                + "</sheets></workbook>";

        Map<Integer, String> names = WorkbookIndexReader.parse(xml.getBytes(StandardCharsets.UTF_8));

        assertEquals(Arrays.asList(3, 1, 2), new ArrayList<>(names.keySet()));
        assertEquals("Summary", names.get(3));
        assertEquals("Data", names.get(1));
        assertEquals("Notes", names.get(2));
    }

    @Test
    public void parse_acceptsAnyRelationshipPrefix() {
        String xml = "<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\""
                + " xmlns:rel=\"http://purl.oclc.org/ooxml/officeDocument/relationships\"><sheets>"
                + "<sheet name=\"Strict\" sheetId=\"1\" rel:id=\"rId7\"/>"
                + "</sheets></workbook>";

        assertEquals(Map.of(7, "Strict"), WorkbookIndexReader.parse(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void parse_firstDeclarationOfAnIdWins() {
        String xml = "<workbook xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\"><sheets>"
                + "<sheet name=\"First\" r:id=\"rId1\"/><sheet name=\"Second\" r:id=\"rId1\"/>"
                + "<sheet name=\"NoId\"/>"
                + "</sheets></workbook>";

        assertEquals(Map.of(1, "First"), WorkbookIndexReader.parse(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void parse_rejectsMalformedXml() {
        assertThrows(SheetFormatException.class,
                () -> WorkbookIndexReader.parse("<workbook><sheets>".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void relationshipNumber_stripsPrefix() {
        assertEquals(12, WorkbookIndexReader.relationshipNumber("rId12"));
        assertNull(WorkbookIndexReader.relationshipNumber("rId"));
        assertNull(WorkbookIndexReader.relationshipNumber(null));
    }

    @Test
    public void load_missingManifestYieldsEmptyMap() throws IOException {
        Path file = XlsxFixtures.workbook().sharedStrings("x").writeTo(tempDir, "nomanifest.xlsx");

        try (ExcelArchive archive = ExcelArchive.open(file)) {
            assertTrue(WorkbookIndexReader.load(archive).isEmpty());
        }
    }
}
