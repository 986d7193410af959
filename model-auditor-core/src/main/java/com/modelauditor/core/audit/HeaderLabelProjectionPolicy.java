package com.modelauditor.core.audit;

import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.TypedValue;
import com.modelauditor.core.model.ValueType;
import com.modelauditor.core.workbook.UsedRange;
import com.modelauditor.core.workbook.WorkbookSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds forecast columns by reading period labels in the top rows of a sheet.
 *
 * <p>A label is historical when it ends a period with a historical marker
 * ({@code 2023A}, {@code FY22 A}) or contains a historical word ({@code Actual},
 * {@code LTM}); it is a projection when it ends a period with a projection marker
 * ({@code 2025E}, {@code 2026F}) or contains a projection word ({@code Forecast},
 * {@code Budget}). The topmost classified label of a column decides.
 *
 * <p>The region is every labelled column right of the last historical column.
 * Without historical columns it is the projection-labelled columns. Bare years
 * classify nothing.
 */
public class HeaderLabelProjectionPolicy implements ProjectionRegionPolicy {

    private static final Pattern PERIOD_SUFFIX =
        Pattern.compile("(?:\\d{2,4}|q[1-4]|h[12])\\s*'?([a-z]{1,2})$");

    private enum Period { HISTORICAL, PROJECTION }

    private final int headerScanRows;
    private final List<String> historicalMarkers;
    private final List<String> projectionMarkers;

    public HeaderLabelProjectionPolicy() {
        this(AuditConfig.PlugConfig.defaults());
    }

    public HeaderLabelProjectionPolicy(AuditConfig.PlugConfig config) {
        this.headerScanRows = config.headerScanRows();
        this.historicalMarkers = config.historicalMarkers();
        this.projectionMarkers = config.projectionMarkers();
    }

    @Override
    public Optional<ProjectionRegion> locate(WorkbookSnapshot workbook, String sheet) {
        Optional<UsedRange> used = workbook.usedRange(sheet);
        if (used.isEmpty()) {
            return Optional.empty();
        }
        UsedRange range = used.get();
        int lastScanRow = Math.min(range.lastRow(), range.firstRow() + headerScanRows - 1);

        TreeMap<Integer, Period> periods = new TreeMap<>();
        int headerRow = 0;
        for (int column = range.firstColumn(); column <= range.lastColumn(); column++) {
            for (int row = range.firstRow(); row <= lastScanRow; row++) {
                TypedValue value = workbook.valueAt(new CellRef(sheet, row, column));
                if (value.type() != ValueType.TEXT) {
                    continue;
                }
                Optional<Period> period = classify(value.display());
                if (period.isPresent()) {
                    periods.put(column, period.get());
                    headerRow = Math.max(headerRow, row);
                    break;
                }
            }
        }
        if (periods.isEmpty()) {
            return Optional.empty();
        }

        int lastHistorical = periods.entrySet().stream()
            .filter(e -> e.getValue() == Period.HISTORICAL)
            .mapToInt(Map.Entry::getKey)
            .max()
            .orElse(0);

        List<Integer> columns = new ArrayList<>();
        for (Map.Entry<Integer, Period> entry : periods.entrySet()) {
            boolean afterHistory = lastHistorical > 0 && entry.getKey() > lastHistorical;
            boolean projected = lastHistorical == 0 && entry.getValue() == Period.PROJECTION;
            if (afterHistory || projected) {
                columns.add(entry.getKey());
            }
        }
        return columns.isEmpty() ? Optional.empty() : Optional.of(new ProjectionRegion(sheet, headerRow, columns));
    }

    private Optional<Period> classify(String label) {
        String text = LabelMatcher.normalize(label);
        Matcher suffix = PERIOD_SUFFIX.matcher(text);
        if (suffix.find()) {
            String marker = suffix.group(1);
            if (historicalMarkers.contains(marker)) {
                return Optional.of(Period.HISTORICAL);
            }
            if (projectionMarkers.contains(marker)) {
                return Optional.of(Period.PROJECTION);
            }
        }
        for (String word : LabelMatcher.words(text)) {
            if (word.length() > 2 && historicalMarkers.contains(word)) {
                return Optional.of(Period.HISTORICAL);
            }
            if (word.length() > 2 && projectionMarkers.contains(word)) {
                return Optional.of(Period.PROJECTION);
            }
        }
        return Optional.empty();
    }
}
