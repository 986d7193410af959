package com.modelauditor.core.audit;

import java.util.List;
import java.util.Objects;

/**
 * Forecast columns of one sheet.
 *
 * @param sheet sheet name
 * @param headerRow last row holding a period label; data rows start below it
 * @param columns projection columns, ascending
 */
public record ProjectionRegion(String sheet, int headerRow, List<Integer> columns) {

    public ProjectionRegion {
        Objects.requireNonNull(sheet, "sheet must not be null");
        columns = columns.stream().sorted().distinct().toList();
    }

    public boolean contains(int column) {
        return columns.contains(column);
    }

    /**
     * Returns true when the region spans more than one column; single-column
     * regions carry too little signal for the plug heuristic.
     *
     * @return true for two or more columns
     */
    public boolean spansMultipleColumns() {
        return columns.size() > 1;
    }
}
