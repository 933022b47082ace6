package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.SheetFormatException;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Streams the rows of a worksheet while its XML is being scanned.
 * <p>
 * A row is flushed as soon as a cell of a later row arrives; skipped row indices are
 * emitted as all-null rows and the table is padded with empty rows up to its height
 * at the end, so the sequence always has {@code height} rows, each {@code width} wide.
 * Cells must arrive in ascending row order.
 */
class LazyRowIterator implements Iterator<List<String>> {

    private final CellScanner scanner;
    private final CellReferenceCodec codec;
    private final CellValueResolver resolver;
    private final TableShape shape;
    private final String sheetName;
    private final Deque<List<String>> ready = new ArrayDeque<>();

    private String[] buffer;
    private int bufferRow = -1;
    private int emitted = 0;
    private boolean finished = false;

    LazyRowIterator(CellScanner scanner, CellReferenceCodec codec, CellValueResolver resolver,
                    TableShape shape, String sheetName) {
        this.scanner = scanner;
        this.codec = codec;
        this.resolver = resolver;
        this.shape = shape;
        this.sheetName = sheetName;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !finished) {
            advance();
        }
        return !ready.isEmpty();
    }

    @Override
    public List<String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.removeFirst();
    }

    private void advance() {
        RawCell cell = scanner.nextCell();
        if (cell == null) {
            flushBuffer();
            padTo(shape.getHeight());
            scanner.close();
            finished = true;
            return;
        }
        CellCoordinate coordinate = codec.decodeCell(cell.getReference());
        if (!shape.contains(coordinate)) {
            throw new SheetFormatException("Cell " + cell.getReference() + " lies outside the "
                    + shape.getWidth() + "x" + shape.getHeight() + " table of sheet " + sheetName);
        }
        if (coordinate.getRow() < bufferRow) {
            throw new SheetFormatException("Cell " + cell.getReference() + " of sheet " + sheetName
                    + " appears after row " + (bufferRow + 1));
        }
        if (coordinate.getRow() > bufferRow) {
            flushBuffer();
            padTo(coordinate.getRow());
            buffer = new String[shape.getWidth()];
            bufferRow = coordinate.getRow();
        }
        buffer[coordinate.getColumn()] = resolver.resolve(cell);
    }

    private void flushBuffer() {
        if (buffer != null) {
            emit(buffer);
            buffer = null;
        }
    }

    private void padTo(int row) {
        while (emitted < row) {
            emit(new String[shape.getWidth()]);
        }
    }

    private void emit(String[] row) {
        ready.addLast(Collections.unmodifiableList(Arrays.asList(row)));
        emitted++;
    }
}
