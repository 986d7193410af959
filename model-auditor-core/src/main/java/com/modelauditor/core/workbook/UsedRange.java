package com.modelauditor.core.workbook;

import java.util.Objects;

/**
 * Bounding box of the populated cells on one sheet, 1-based and inclusive.
 *
 * @param sheet sheet name
 * @param firstRow first populated row
 * @param firstColumn first populated column
 * @param lastRow last populated row
 * @param lastColumn last populated column
 */
public record UsedRange(
    String sheet,
    int firstRow,
    int firstColumn,
    int lastRow,
    int lastColumn
) {
    /**
     * Compact constructor with validation.
     */
    public UsedRange {
        Objects.requireNonNull(sheet, "sheet must not be null");
        if (firstRow < 1 || firstColumn < 1 || lastRow < firstRow || lastColumn < firstColumn) {
            throw new IllegalArgumentException(String.format(
                "Invalid used range on %s: rows %d-%d, columns %d-%d",
                sheet, firstRow, lastRow, firstColumn, lastColumn));
        }
    }

    /**
     * Returns a range covering a single cell.
     *
     * @param sheet sheet name
     * @param row row
     * @param column column
     * @return one-cell range
     */
    public static UsedRange of(String sheet, int row, int column) {
        return new UsedRange(sheet, row, column, row, column);
    }

    /**
     * Returns the smallest range covering this one and the given cell.
     *
     * @param row row
     * @param column column
     * @return widened range
     */
    public UsedRange include(int row, int column) {
        return new UsedRange(sheet,
            Math.min(firstRow, row), Math.min(firstColumn, column),
            Math.max(lastRow, row), Math.max(lastColumn, column));
    }

    public boolean contains(int row, int column) {
        return row >= firstRow && row <= lastRow && column >= firstColumn && column <= lastColumn;
    }

    public int rowCount() {
        return lastRow - firstRow + 1;
    }

    public int columnCount() {
        return lastColumn - firstColumn + 1;
    }
}
