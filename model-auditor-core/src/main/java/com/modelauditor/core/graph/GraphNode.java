package com.modelauditor.core.graph;

import com.modelauditor.core.model.CellRef;

import java.util.Objects;

/**
 * Node of a {@link DependencyGraph}.
 *
 * @param id dense id, assigned in {@link CellRef} order
 * @param cell coordinate
 * @param state node state
 */
public record GraphNode(int id, CellRef cell, NodeState state) {

    public GraphNode {
        Objects.requireNonNull(cell, "cell must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
