package com.modelauditor.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything the snapshot knows about one coordinate.
 *
 * @param ref coordinate
 * @param value evaluated (cached) value
 * @param formula raw formula text starting with {@code =}, empty for literal cells
 */
public record CellRecord(
    CellRef ref,
    TypedValue value,
    Optional<String> formula
) {
    /**
     * Compact constructor with validation.
     */
    public CellRecord {
        Objects.requireNonNull(ref, "ref must not be null");
        if (value == null) {
            value = TypedValue.EMPTY;
        }
        if (formula == null) {
            formula = Optional.empty();
        }
    }

    /**
     * Derives the cell kind. An error token wins over the formula/literal split.
     *
     * @return cell kind
     */
    public CellKind kind() {
        if (value.type() == ValueType.ERROR) {
            return CellKind.ERROR;
        }
        return formula.isPresent() ? CellKind.FORMULA : CellKind.LITERAL;
    }

    /**
     * Returns true if the cell carries formula text.
     *
     * @return true for formula cells, including those evaluating to an error
     */
    public boolean hasFormula() {
        return formula.isPresent();
    }
}
