package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.MalformedReferenceException;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts Excel A1-style references to zero-based coordinates and back.
 * <p>
 * Column letters are a bijective base-26 number (A=1 ... Z=26, AA=27) shifted down by one,
 * so A maps to column 0 and AA to column 26. Column decodes are memoized per instance;
 * one codec is created per worksheet.
 */
public class CellReferenceCodec {

    static final int MAX_COLUMN_LETTERS = 3;
    /** Number of columns addressable with at most three letters (A..ZZZ). */
    public static final int MAX_COLUMNS = 26 + 26 * 26 + 26 * 26 * 26;

    private final Map<String, Integer> columnCache = new HashMap<>();

    public int decodeColumn(String letters) {
        return decodeColumn(letters, letters);
    }

    public CellCoordinate decodeCell(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new MalformedReferenceException(String.valueOf(reference), "empty reference");
        }
        int split = 0;
        while (split < reference.length() && isLetter(reference.charAt(split))) {
            split++;
        }
        if (split == 0) {
            throw new MalformedReferenceException(reference, "no column letters");
        }
        if (split == reference.length()) {
            throw new MalformedReferenceException(reference, "no row digits");
        }
        String digits = reference.substring(split);
        for (int i = 0; i < digits.length(); i++) {
            if (!isDigit(digits.charAt(i))) {
                throw new MalformedReferenceException(reference, "letters and digits are not contiguous");
            }
        }
        int row;
        try {
            row = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedReferenceException(reference, "row number out of range");
        }
        if (row < 1) {
            throw new MalformedReferenceException(reference, "row numbers start at 1");
        }
        int column = decodeColumn(reference.substring(0, split), reference);
        return new CellCoordinate(column, row - 1);
    }

    /**
     * Shape of a dimension range such as {@code A1:D20}, assuming the range starts at A1.
     * A single reference is its own bottom-right corner.
     */
    public TableShape shapeFromRange(String range) {
        if (range == null || range.isEmpty()) {
            throw new MalformedReferenceException(String.valueOf(range), "empty range");
        }
        int colon = range.indexOf(':');
        String bottomRight = colon < 0 ? range : range.substring(colon + 1);
        if (colon >= 0) {
            // top-left is validated only
            decodeCell(range.substring(0, colon));
        }
        CellCoordinate corner = decodeCell(bottomRight);
        return new TableShape(corner.getColumn() + 1, corner.getRow() + 1);
    }

    public static String encodeColumn(int column) {
        if (column < 0 || column >= MAX_COLUMNS) {
            throw new IllegalArgumentException("Column index out of range: " + column);
        }
        char[] chars = new char[MAX_COLUMN_LETTERS];
        int i = chars.length;
        int n = column + 1;
        while (n != 0) {
            chars[--i] = (char) ('A' + (n - 1) % 26);
            n = (n - 1) / 26;
        }
        return new String(chars, i, MAX_COLUMN_LETTERS - i);
    }

    public static String encodeCell(CellCoordinate coordinate) {
        return encodeColumn(coordinate.getColumn()) + (coordinate.getRow() + 1);
    }

    private int decodeColumn(String letters, String reference) {
        Integer cached = columnCache.get(letters);
        if (cached != null) {
            return cached;
        }
        int column = parseColumn(letters, reference);
        columnCache.put(letters, column);
        return column;
    }

    private static int parseColumn(String letters, String reference) {
        if (letters == null || letters.isEmpty()) {
            throw new MalformedReferenceException(String.valueOf(reference), "no column letters");
        }
        if (letters.length() > MAX_COLUMN_LETTERS) {
            throw new MalformedReferenceException(reference, "more than " + MAX_COLUMN_LETTERS + " column letters");
        }
        int value = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (!isLetter(c)) {
                throw new MalformedReferenceException(reference, "invalid column letter '" + c + "'");
            }
            value = value * 26 + (Character.toUpperCase(c) - 'A' + 1);
        }
        return value - 1;
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
