package com.modelauditor.core.graph;

import com.modelauditor.core.model.CellRef;

import java.util.List;

/**
 * Strongly connected component of the dependency graph that forms a circular
 * reference: two or more mutually dependent cells, or one cell referencing itself.
 *
 * @param members cells in the component, in {@link CellRef} order
 */
public record Cycle(List<CellRef> members) {

    public Cycle {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one member");
        }
        members = members.stream().sorted().toList();
    }

    /**
     * Returns the first member in {@link CellRef} order.
     *
     * @return lowest member
     */
    public CellRef first() {
        return members.get(0);
    }

    public boolean isSelfLoop() {
        return members.size() == 1;
    }

    public boolean contains(CellRef cell) {
        return members.contains(cell);
    }

    public int size() {
        return members.size();
    }
}
