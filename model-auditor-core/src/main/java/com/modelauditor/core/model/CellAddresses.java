package com.modelauditor.core.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between A1 notation and numeric coordinates.
 */
public final class CellAddresses {

    /** Last column of the .xlsx grid (XFD). */
    public static final int MAX_COLUMN = 16_384;

    /** Last row of the .xlsx grid. */
    public static final int MAX_ROW = 1_048_576;

    private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?(\\d{1,7})");
    private static final Pattern PLAIN_SHEET = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private CellAddresses() {
        // Utility class
    }

    /**
     * Converts a 1-based column index to letters.
     *
     * @param column 1-based column
     * @return column letters
     */
    public static String columnLetters(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1: " + column);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int rem = (remaining - 1) % 26;
            sb.append((char) ('A' + rem));
            remaining = (remaining - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Converts column letters to a 1-based index, ignoring a leading {@code $}.
     *
     * @param letters column letters, case-insensitive
     * @return 1-based column, or -1 when the text is not a valid column
     */
    public static int columnIndex(String letters) {
        String text = letters.startsWith("$") ? letters.substring(1) : letters;
        if (text.isEmpty() || text.length() > 3) {
            return -1;
        }
        int result = 0;
        for (char c : text.toUpperCase(Locale.ROOT).toCharArray()) {
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result <= MAX_COLUMN ? result : -1;
    }

    /**
     * Parses an A1 cell address.
     *
     * @param sheet sheet the address belongs to
     * @param address address such as {@code $C$4}
     * @return resolved reference
     * @throws IllegalArgumentException for malformed or out-of-grid addresses
     */
    public static CellRef parseCell(String sheet, String address) {
        Matcher m = CELL.matcher(address.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a cell address: " + address);
        }
        int column = columnIndex(m.group(1));
        int row = Integer.parseInt(m.group(2));
        if (column < 1 || row < 1 || row > MAX_ROW) {
            throw new IllegalArgumentException("Address outside the sheet grid: " + address);
        }
        return new CellRef(sheet, row, column);
    }

    /**
     * Quotes a sheet name when it would not survive unquoted in a formula. A name
     * that reads like a cell address ({@code AB12}) is quoted too.
     *
     * @param sheet sheet name
     * @return sheet name, single-quoted if required
     */
    public static String quoteSheet(String sheet) {
        if (PLAIN_SHEET.matcher(sheet).matches() && !CELL.matcher(sheet).matches()) {
            return sheet;
        }
        return "'" + sheet.replace("'", "''") + "'";
    }
}
