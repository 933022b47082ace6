package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.SheetFormatException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One worksheet part of a {@link Workbook}.
 * <p>
 * The raw XML is held in memory; its table shape is read once at construction from the
 * {@code <dimension>} element (or, when a sheet declares none, from the extent of its cells).
 * Values can be read as a dense grid ({@link #materialize()}) or as a row stream ({@link #rows()});
 * both yield the same value at every coordinate.
 */
@Slf4j
public class Worksheet {

    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");

    private final Workbook workbook;
    private final String entryName;
    private final byte[] content;
    private final String name;
    private final CellReferenceCodec codec = new CellReferenceCodec();
    private final TableShape shape;

    private List<List<String>> materialized;
    private List<Map<String, String>> records;

    Worksheet(Workbook workbook, String entryName, byte[] content) {
        this.workbook = workbook;
        this.entryName = entryName;
        this.content = content;
        this.name = displayName(entryName, workbook.getDeclaredNames());
        this.shape = readShape();
        log.debug("Sheet {} ({}) has shape {}x{}", name, entryName, shape.getWidth(), shape.getHeight());
    }

    public String getName() {
        return name;
    }

    public String getEntryName() {
        return entryName;
    }

    public int getWidth() {
        return shape.getWidth();
    }

    public int getHeight() {
        return shape.getHeight();
    }

    /**
     * Dense {@code height x width} grid, missing cells null. Computed once.
     */
    public List<List<String>> materialize() {
        if (materialized == null) {
            String[][] grid = new String[shape.getHeight()][shape.getWidth()];
            CellValueResolver resolver = newResolver();
            try (CellScanner scanner = new CellScanner(content, codec)) {
                RawCell cell;
                while ((cell = scanner.nextCell()) != null) {
                    CellCoordinate coordinate = codec.decodeCell(cell.getReference());
                    checkInside(cell, coordinate);
                    grid[coordinate.getRow()][coordinate.getColumn()] = resolver.resolve(cell);
                }
            }
            List<List<String>> rows = new ArrayList<>(grid.length);
            for (String[] row : grid) {
                rows.add(Collections.unmodifiableList(Arrays.asList(row)));
            }
            materialized = Collections.unmodifiableList(rows);
        }
        return materialized;
    }

    /**
     * Fresh row stream over the sheet XML. Yields {@code height} rows of {@code width} values.
     */
    public Iterator<List<String>> rows() {
        return new LazyRowIterator(new CellScanner(content, codec), codec, newResolver(), shape, name);
    }

    /**
     * Records keyed by the first row, built from the grid when it is already materialized
     * and from the row stream otherwise. Computed once.
     */
    public List<Map<String, String>> records() {
        if (records == null) {
            if (materialized != null) {
                records = TableProjector.toRecords(materialized, name);
            } else {
                List<Map<String, String>> list = new ArrayList<>();
                TableProjector.toRecords(rows(), name).forEachRemaining(list::add);
                records = Collections.unmodifiableList(list);
            }
        }
        return records;
    }

    private CellValueResolver newResolver() {
        return new CellValueResolver(workbook.getSharedStrings(), workbook.isSanitize());
    }

    private TableShape readShape() {
        String dimension;
        try (CellScanner scanner = new CellScanner(content, codec)) {
            dimension = scanner.readDimension();
        }
        if (dimension != null && !dimension.isBlank()) {
            return codec.shapeFromRange(dimension.trim());
        }
        log.debug("Sheet {} declares no dimension, sizing it from its cells", name);
        TableShape derived = TableShape.EMPTY;
        try (CellScanner scanner = new CellScanner(content, codec)) {
            RawCell cell;
            while ((cell = scanner.nextCell()) != null) {
                derived = derived.expandTo(codec.decodeCell(cell.getReference()));
            }
        }
        return derived;
    }

    private void checkInside(RawCell cell, CellCoordinate coordinate) {
        if (!shape.contains(coordinate)) {
            throw new SheetFormatException("Cell " + cell.getReference() + " lies outside the "
                    + shape.getWidth() + "x" + shape.getHeight() + " table of sheet " + name);
        }
    }

    /**
     * {@code NN_Declared Name}, NN being the entry's sheet number, when the workbook declares a
     * name for the entry; otherwise the entry's file stem (e.g. {@code sheet1}).
     */
    static String displayName(String entryName, Map<String, String> declaredNames) {
        String fileName = entryName.substring(entryName.lastIndexOf('/') + 1);
        String stem = fileName.endsWith(".xml") ? fileName.substring(0, fileName.length() - 4) : fileName;
        String declared = declaredNames.get(entryName);
        long number = ExcelArchive.worksheetNumber(entryName);
        if (declared == null || number < 0) {
            return stem;
        }
        return String.format("%02d_%s", number, UNSAFE_NAME_CHARS.matcher(declared).replaceAll("_"));
    }
}
