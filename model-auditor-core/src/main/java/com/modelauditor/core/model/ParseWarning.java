package com.modelauditor.core.model;

import java.util.Objects;

/**
 * A formula that could not be tokenized, or was only partly resolved.
 *
 * @param cell cell holding the formula
 * @param formula raw formula text
 * @param message reason
 */
public record ParseWarning(
    CellRef cell,
    String formula,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ParseWarning {
        Objects.requireNonNull(cell, "cell must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (formula == null) {
            formula = "";
        }
    }
}
