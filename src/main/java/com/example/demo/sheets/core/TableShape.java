package com.example.demo.sheets.core;

import lombok.Value;

/**
 * Exclusive-bound size of a worksheet table.
 */
@Value
public class TableShape {

    public static final TableShape EMPTY = new TableShape(0, 0);

    int width;
    int height;

    public boolean contains(CellCoordinate coordinate) {
        return coordinate.getColumn() >= 0 && coordinate.getColumn() < width
                && coordinate.getRow() >= 0 && coordinate.getRow() < height;
    }

    public TableShape expandTo(CellCoordinate coordinate) {
        return new TableShape(Math.max(width, coordinate.getColumn() + 1), Math.max(height, coordinate.getRow() + 1));
    }
}
