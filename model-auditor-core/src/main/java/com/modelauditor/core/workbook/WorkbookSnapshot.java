package com.modelauditor.core.workbook;

import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.TypedValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of a loaded workbook: the evaluated values and the formula text of
 * every populated cell, keyed by {@link CellRef}.
 *
 * <p>{@code values} and {@code formulas} have the same key set. A key maps to an
 * empty {@code Optional} in {@code formulas} when the cell is a literal. Value-only
 * inputs (CSV) report {@code formulasAvailable = false} and map every key to empty.
 *
 * <p>{@code cells} lists the keys in {@link CellRef} order; iterate it rather than the
 * maps whenever output order matters.
 *
 * @param workbookName file name of the source
 * @param sheetNames sheet names in workbook order
 * @param values evaluated value per populated cell
 * @param formulas formula text per populated cell
 * @param cells populated cells, sorted
 * @param usedRanges bounding box per sheet that has content
 * @param definedNames defined name to its refers-to formula; keys upper-case,
 *                     sheet-scoped names keyed {@code SHEET!NAME}
 * @param externalWorkbooks linked file names, index 0 is external link {@code [1]}
 * @param formulasAvailable false when the source cannot carry formulas
 * @param diagnostics notes raised while loading
 */
public record WorkbookSnapshot(
    String workbookName,
    List<String> sheetNames,
    Map<CellRef, TypedValue> values,
    Map<CellRef, Optional<String>> formulas,
    List<CellRef> cells,
    Map<String, UsedRange> usedRanges,
    Map<String, String> definedNames,
    List<String> externalWorkbooks,
    boolean formulasAvailable,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public WorkbookSnapshot {
        Objects.requireNonNull(workbookName, "workbookName must not be null");
        sheetNames = List.copyOf(sheetNames);
        values = Map.copyOf(values);
        formulas = Map.copyOf(formulas);
        cells = List.copyOf(cells);
        usedRanges = Map.copyOf(usedRanges);
        definedNames = definedNames == null ? Map.of() : Map.copyOf(definedNames);
        externalWorkbooks = externalWorkbooks == null ? List.of() : List.copyOf(externalWorkbooks);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        if (!values.keySet().equals(formulas.keySet())) {
            throw new IllegalArgumentException("values and formulas must cover the same cells");
        }
    }

    /**
     * Starts building a snapshot.
     *
     * @param workbookName source file name
     * @return builder
     */
    public static Builder builder(String workbookName) {
        return new Builder(workbookName);
    }

    /**
     * Returns the record for a populated cell.
     *
     * @param ref coordinate
     * @return record, or empty when nothing is stored there
     */
    public Optional<CellRecord> cell(CellRef ref) {
        TypedValue value = values.get(ref);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(new CellRecord(ref, value, formulas.get(ref)));
    }

    /**
     * Returns the value at a coordinate, {@link TypedValue#EMPTY} when blank.
     *
     * @param ref coordinate
     * @return value
     */
    public TypedValue valueAt(CellRef ref) {
        return values.getOrDefault(ref, TypedValue.EMPTY);
    }

    public boolean contains(CellRef ref) {
        return values.containsKey(ref);
    }

    /**
     * Returns every populated cell as a record, in {@link CellRef} order.
     *
     * @return records
     */
    public List<CellRecord> records() {
        return cells.stream().map(ref -> new CellRecord(ref, values.get(ref), formulas.get(ref))).toList();
    }

    /**
     * Returns formula cells in {@link CellRef} order.
     *
     * @return formula records
     */
    public List<CellRecord> formulaCells() {
        return records().stream().filter(CellRecord::hasFormula).toList();
    }

    /**
     * Returns populated cells of one sheet, in row-major order.
     *
     * @param sheet sheet name
     * @return records on the sheet
     */
    public List<CellRecord> sheetRecords(String sheet) {
        return records().stream().filter(r -> r.ref().sheet().equals(sheet)).toList();
    }

    /**
     * Resolves a sheet name the way a spreadsheet does, ignoring case.
     *
     * @param name sheet name as written in a formula
     * @return the workbook's spelling, or empty when no such sheet exists
     */
    public Optional<String> canonicalSheet(String name) {
        for (String sheet : sheetNames) {
            if (sheet.equalsIgnoreCase(name)) {
                return Optional.of(sheet);
            }
        }
        return Optional.empty();
    }

    public Optional<UsedRange> usedRange(String sheet) {
        return Optional.ofNullable(usedRanges.get(sheet));
    }

    /**
     * Looks up a defined name, sheet scope first.
     *
     * @param sheet sheet the formula lives on
     * @param name defined name
     * @return refers-to formula without the leading {@code =}, or empty
     */
    public Optional<String> definedName(String sheet, String name) {
        String key = name.toUpperCase(Locale.ROOT);
        String scoped = definedNames.get(sheet.toUpperCase(Locale.ROOT) + "!" + key);
        return Optional.ofNullable(scoped != null ? scoped : definedNames.get(key));
    }

    /**
     * Builder used by loaders and test fixtures. Cells can be added in any order.
     */
    public static final class Builder {
        private final String workbookName;
        private final List<String> sheetNames = new ArrayList<>();
        private final Map<CellRef, TypedValue> values = new HashMap<>();
        private final Map<CellRef, Optional<String>> formulas = new HashMap<>();
        private final Map<String, UsedRange> usedRanges = new LinkedHashMap<>();
        private final Map<String, String> definedNames = new HashMap<>();
        private final List<String> externalWorkbooks = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private boolean formulasAvailable = true;

        private Builder(String workbookName) {
            this.workbookName = workbookName;
        }

        public Builder sheet(String name) {
            if (!sheetNames.contains(name)) {
                sheetNames.add(name);
            }
            return this;
        }

        /**
         * Adds a literal cell. Empty values are ignored.
         */
        public Builder value(CellRef ref, TypedValue value) {
            return put(ref, value, Optional.empty());
        }

        public Builder value(String sheet, String address, double number) {
            return value(CellRef.of(sheet, address), TypedValue.number(number));
        }

        public Builder value(String sheet, String address, String text) {
            return value(CellRef.of(sheet, address), TypedValue.text(text));
        }

        /**
         * Adds a formula cell with its cached value.
         *
         * @param ref coordinate
         * @param formula formula text; a missing {@code =} is added
         * @param cached evaluated value, may be {@link TypedValue#EMPTY}
         */
        public Builder formula(CellRef ref, String formula, TypedValue cached) {
            String text = formula.startsWith("=") ? formula : "=" + formula;
            return put(ref, cached, Optional.of(text));
        }

        public Builder formula(String sheet, String address, String formula, double cached) {
            return formula(CellRef.of(sheet, address), formula, TypedValue.number(cached));
        }

        public Builder formula(String sheet, String address, String formula) {
            return formula(CellRef.of(sheet, address), formula, TypedValue.EMPTY);
        }

        public Builder definedName(String scopeSheet, String name, String refersTo) {
            String key = name.toUpperCase(Locale.ROOT);
            if (scopeSheet != null) {
                key = scopeSheet.toUpperCase(Locale.ROOT) + "!" + key;
            }
            String text = refersTo.startsWith("=") ? refersTo.substring(1) : refersTo;
            definedNames.put(key, text);
            return this;
        }

        public Builder externalWorkbook(String fileName) {
            externalWorkbooks.add(fileName);
            return this;
        }

        public Builder formulasAvailable(boolean available) {
            this.formulasAvailable = available;
            return this;
        }

        public Builder diagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        private Builder put(CellRef ref, TypedValue value, Optional<String> formula) {
            if (formula.isEmpty() && (value == null || value.isEmpty())) {
                return this;
            }
            sheet(ref.sheet());
            values.put(ref, value == null ? TypedValue.EMPTY : value);
            formulas.put(ref, formula);
            usedRanges.merge(ref.sheet(), UsedRange.of(ref.sheet(), ref.row(), ref.column()),
                (existing, added) -> existing.include(ref.row(), ref.column()));
            return this;
        }

        public WorkbookSnapshot build() {
            List<CellRef> sorted = new ArrayList<>(values.keySet());
            sorted.sort(null);
            return new WorkbookSnapshot(workbookName, sheetNames, values, formulas, sorted,
                usedRanges, definedNames, externalWorkbooks, formulasAvailable, diagnostics);
        }
    }
}
