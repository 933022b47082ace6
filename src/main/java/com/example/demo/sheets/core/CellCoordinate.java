package com.example.demo.sheets.core;

import lombok.Value;

/**
 * Zero-based (column, row) position of a cell.
 */
@Value
public class CellCoordinate {
    int column;
    int row;
}
