package com.modelauditor.core.graph;

import com.modelauditor.core.model.CellKind;

/**
 * State of a node in the dependency graph.
 */
public enum NodeState {
    /** Populated cell holding a formula. */
    FORMULA,
    /** Populated cell holding a constant. */
    LITERAL,
    /** Populated cell whose value is an error token. */
    ERROR,
    /** Blank cell covered by a range reference; a valid input. */
    EMPTY,
    /** Cell referenced directly, or on a sheet that does not exist; a dangling pointer. */
    MISSING;

    /**
     * Maps the kind of a populated cell to its node state.
     *
     * @param kind cell kind
     * @return node state
     */
    public static NodeState of(CellKind kind) {
        return switch (kind) {
            case FORMULA -> FORMULA;
            case LITERAL -> LITERAL;
            case ERROR -> ERROR;
        };
    }

    public boolean isPopulated() {
        return this == FORMULA || this == LITERAL || this == ERROR;
    }
}
