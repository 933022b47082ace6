package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.MalformedReferenceException;
import org.apache.poi.ss.util.CellReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class CellReferenceCodecTest {

    private final CellReferenceCodec codec = new CellReferenceCodec();

    @ParameterizedTest
    @CsvSource({
            "A, 0",
            "B, 1",
            "Z, 25",
            "AA, 26",
            "AB, 27",
            "AZ, 51",
            "BA, 52",
            "ZZ, 701",
            "AAA, 702",
            "XFD, 16383"
    })
    public void decodeColumn_followsExcelLettering(String letters, int expected) {
        assertEquals(expected, codec.decodeColumn(letters));
    }

    @Test
    public void decodeColumn_isCaseInsensitive() {
        assertEquals(codec.decodeColumn("AB"), codec.decodeColumn("ab"));
        assertEquals(codec.decodeColumn("XFD"), codec.decodeColumn("xFd"));
    }

    @Test
    public void decodeColumn_repeatedLookupsAgree() {
        int first = codec.decodeColumn("QR");
        assertEquals(first, codec.decodeColumn("QR"));
        assertEquals(first, new CellReferenceCodec().decodeColumn("QR"));
    }

    @Test
    public void columnRoundTrip_coversAllThreeLetterColumns() {
        for (int n = 0; n < CellReferenceCodec.MAX_COLUMNS; n++) {
            String letters = CellReferenceCodec.encodeColumn(n);
            assertEquals(n, codec.decodeColumn(letters), "column " + letters);
        }
    }

    @Test
    public void columnLettering_agreesWithPoi() {
        for (int n = 0; n < CellReferenceCodec.MAX_COLUMNS; n += 37) {
            String letters = CellReference.convertNumToColString(n);
            assertEquals(letters, CellReferenceCodec.encodeColumn(n));
            assertEquals(CellReference.convertColStringToIndex(letters), codec.decodeColumn(letters));
        }
    }

    @Test
    public void encodeColumn_rejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> CellReferenceCodec.encodeColumn(-1));
        assertThrows(IllegalArgumentException.class,
                () -> CellReferenceCodec.encodeColumn(CellReferenceCodec.MAX_COLUMNS));
    }

    @Test
    public void decodeCell_splitsLettersAndDigits() {
        assertEquals(new CellCoordinate(27, 11), codec.decodeCell("AB12"));
        assertEquals(new CellCoordinate(0, 0), codec.decodeCell("A1"));
        assertEquals(new CellCoordinate(2, 99), codec.decodeCell("c100"));
    }

    @Test
    public void encodeCell_isInverseOfDecodeCell() {
        CellCoordinate coordinate = codec.decodeCell("ZZ7");
        assertEquals("ZZ7", CellReferenceCodec.encodeCell(coordinate));
    }

    @ParameterizedTest
    @ValueSource(strings = {"12A", "A", "12", "A1B", "A0", "", "AAAA1", "A-1", "$A$1", "A1 ", "Ä1"})
    public void decodeCell_rejectsMalformedReferences(String reference) {
        MalformedReferenceException e = assertThrows(MalformedReferenceException.class,
                () -> codec.decodeCell(reference));
        assertEquals(reference, e.getReference());
    }

    @Test
    public void decodeCell_rejectsNull() {
        assertThrows(MalformedReferenceException.class, () -> codec.decodeCell(null));
    }

    @Test
    public void shapeFromRange_usesBottomRightCornerAsExclusiveBound() {
        assertEquals(new TableShape(2, 2), codec.shapeFromRange("A1:B2"));
        assertEquals(new TableShape(16384, 3), codec.shapeFromRange("A1:XFD3"));
        assertEquals(new TableShape(26, 1000), codec.shapeFromRange("A1:Z1000"));
    }

    @Test
    public void shapeFromRange_acceptsSingleCellDimension() {
        assertEquals(new TableShape(1, 1), codec.shapeFromRange("A1"));
        assertEquals(new TableShape(3, 4), codec.shapeFromRange("C4"));
    }

    @Test
    public void shapeFromRange_rejectsMalformedCorners() {
        assertThrows(MalformedReferenceException.class, () -> codec.shapeFromRange("A1:12"));
        assertThrows(MalformedReferenceException.class, () -> codec.shapeFromRange("1A:B2"));
        assertThrows(MalformedReferenceException.class, () -> codec.shapeFromRange(""));
    }

    @Test
    public void everyCellOfTheRangeFitsTheShape() {
        TableShape shape = codec.shapeFromRange("A1:AC40");
        for (int col = 0; col < 29; col++) {
            for (int row = 1; row <= 40; row++) {
                String ref = CellReferenceCodec.encodeColumn(col) + row;
                assertTrue(shape.contains(codec.decodeCell(ref)), ref);
            }
        }
        assertFalse(shape.contains(codec.decodeCell("AD1")));
        assertFalse(shape.contains(codec.decodeCell("A41")));
    }
}
