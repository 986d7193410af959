package com.modelauditor.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Coordinate of one workbook cell.
 *
 * <p>Identity is the {@code (sheet, row, column)} triple. Absolute markers from the
 * source formula ({@code $A$1}) are not retained: {@code A1} and {@code $A$1} on the
 * same sheet resolve to the same reference.
 *
 * <p>The natural ordering (sheet name, then row, then column) is the order used
 * wherever output must not depend on enumeration order: graph node ids, issue
 * ordering and evidence lists.
 *
 * @param sheet sheet name, as it appears in the workbook
 * @param row 1-based row
 * @param column 1-based column
 */
public record CellRef(
    String sheet,
    int row,
    int column
) implements Comparable<CellRef> {

    private static final Comparator<CellRef> ORDER = Comparator
        .comparing(CellRef::sheet)
        .thenComparingInt(CellRef::row)
        .thenComparingInt(CellRef::column);

    /**
     * Compact constructor with validation.
     */
    public CellRef {
        Objects.requireNonNull(sheet, "sheet must not be null");
        if (row < 1) {
            throw new IllegalArgumentException("row must be >= 1: " + row);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1: " + column);
        }
    }

    /**
     * Creates a reference from an A1-style address such as {@code B7} or {@code $B$7}.
     *
     * @param sheet sheet name
     * @param address A1 address
     * @return parsed reference
     * @throws IllegalArgumentException if the address is not a valid A1 cell address
     */
    public static CellRef of(String sheet, String address) {
        return CellAddresses.parseCell(sheet, address);
    }

    /**
     * Returns the column in letter form ({@code 1 -> A}, {@code 28 -> AB}).
     *
     * @return column letters
     */
    public String columnLetters() {
        return CellAddresses.columnLetters(column);
    }

    /**
     * Returns the address without sheet prefix, e.g. {@code C12}.
     *
     * @return local A1 address
     */
    public String address() {
        return columnLetters() + row;
    }

    /**
     * Returns the fully qualified address, e.g. {@code 'Balance Sheet'!C12}.
     *
     * @return qualified A1 address
     */
    public String toA1() {
        return CellAddresses.quoteSheet(sheet) + "!" + address();
    }

    /**
     * Returns true if both references live on the same sheet.
     *
     * @param other other reference
     * @return true when sheet names are equal
     */
    public boolean sameSheet(CellRef other) {
        return sheet.equals(other.sheet);
    }

    @Override
    public int compareTo(CellRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
