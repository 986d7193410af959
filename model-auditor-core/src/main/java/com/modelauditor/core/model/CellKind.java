package com.modelauditor.core.model;

/**
 * Classification of a populated cell.
 */
public enum CellKind {
    /** Value typed in by hand. */
    LITERAL,
    /** Computed expression. */
    FORMULA,
    /** Value is a spreadsheet error token, whether typed or computed. */
    ERROR
}
