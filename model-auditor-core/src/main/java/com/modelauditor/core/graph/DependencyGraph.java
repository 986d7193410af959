package com.modelauditor.core.graph;

import com.modelauditor.core.model.CellRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable directed graph of cell dependencies.
 *
 * <p>An edge {@code A -> B} means B's formula references A. The graph may contain
 * cycles. Nodes get dense integer ids in {@link CellRef} order, so ids and every
 * adjacency list are stable across runs on the same workbook.
 *
 * <p>Adjacency is stored in compressed sparse row form in both directions:
 * {@code childOffset[i]..childOffset[i+1]} indexes the dependents of node {@code i}
 * in {@code children}, sorted ascending; {@code parentOffset}/{@code parents} hold
 * the precedents the same way.
 */
public final class DependencyGraph {

    private final CellRef[] cells;
    private final NodeState[] states;
    private final boolean[] formulas;
    private final Map<CellRef, Integer> ids;
    private final int[] childOffset;
    private final int[] children;
    private final int[] parentOffset;
    private final int[] parents;

    private DependencyGraph(CellRef[] cells, NodeState[] states, boolean[] formulas, Map<CellRef, Integer> ids,
                            int[] childOffset, int[] children, int[] parentOffset, int[] parents) {
        this.cells = cells;
        this.states = states;
        this.formulas = formulas;
        this.ids = ids;
        this.childOffset = childOffset;
        this.children = children;
        this.parentOffset = parentOffset;
        this.parents = parents;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nodeCount() {
        return cells.length;
    }

    public int edgeCount() {
        return children.length;
    }

    /**
     * Returns the id of a cell.
     *
     * @param cell coordinate
     * @return id, or -1 when the cell is not a node
     */
    public int id(CellRef cell) {
        Integer id = ids.get(cell);
        return id == null ? -1 : id;
    }

    public boolean contains(CellRef cell) {
        return ids.containsKey(cell);
    }

    public CellRef cell(int id) {
        return cells[id];
    }

    public NodeState state(int id) {
        return states[id];
    }

    /**
     * Returns true if the node holds a formula. Formula cells whose cached value is
     * an error are in state {@link NodeState#ERROR} but still hold a formula.
     *
     * @param id node id
     * @return true for formula cells
     */
    public boolean isFormula(int id) {
        return formulas[id];
    }

    /**
     * Returns the node for a cell.
     *
     * @param cell coordinate
     * @return node, or empty when the cell is not in the graph
     */
    public Optional<GraphNode> node(CellRef cell) {
        int id = id(cell);
        return id < 0 ? Optional.empty() : Optional.of(new GraphNode(id, cells[id], states[id]));
    }

    /**
     * Returns all nodes in id order.
     *
     * @return nodes
     */
    public List<GraphNode> nodes() {
        List<GraphNode> nodes = new ArrayList<>(cells.length);
        for (int i = 0; i < cells.length; i++) {
            nodes.add(new GraphNode(i, cells[i], states[i]));
        }
        return nodes;
    }

    /**
     * Returns the cells in a given state, in {@link CellRef} order.
     *
     * @param state node state
     * @return matching cells
     */
    public List<CellRef> cellsIn(NodeState state) {
        List<CellRef> result = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (states[i] == state) {
                result.add(cells[i]);
            }
        }
        return result;
    }

    public int outDegree(int id) {
        return childOffset[id + 1] - childOffset[id];
    }

    public int inDegree(int id) {
        return parentOffset[id + 1] - parentOffset[id];
    }

    /** Returns the i-th dependent of a node. */
    public int child(int id, int i) {
        return children[childOffset[id] + i];
    }

    /** Returns the i-th precedent of a node. */
    public int parent(int id, int i) {
        return parents[parentOffset[id] + i];
    }

    /**
     * Returns true if {@code to} references {@code from}.
     *
     * @param from precedent
     * @param to dependent
     * @return true when the edge exists
     */
    public boolean hasEdge(CellRef from, CellRef to) {
        int source = id(from);
        int target = id(to);
        if (source < 0 || target < 0) {
            return false;
        }
        return Arrays.binarySearch(children, childOffset[source], childOffset[source + 1], target) >= 0;
    }

    /**
     * Returns the cells whose formulas reference the given cell.
     *
     * @param cell precedent
     * @return dependents in {@link CellRef} order, empty when the cell is not a node
     */
    public List<CellRef> dependents(CellRef cell) {
        int id = id(cell);
        if (id < 0) {
            return List.of();
        }
        List<CellRef> result = new ArrayList<>(outDegree(id));
        for (int i = childOffset[id]; i < childOffset[id + 1]; i++) {
            result.add(cells[children[i]]);
        }
        return result;
    }

    /**
     * Returns the cells the given cell's formula references.
     *
     * @param cell dependent
     * @return precedents in {@link CellRef} order, empty when the cell is not a node
     */
    public List<CellRef> precedents(CellRef cell) {
        int id = id(cell);
        if (id < 0) {
            return List.of();
        }
        List<CellRef> result = new ArrayList<>(inDegree(id));
        for (int i = parentOffset[id]; i < parentOffset[id + 1]; i++) {
            result.add(cells[parents[i]]);
        }
        return result;
    }

    /**
     * Builder that accumulates nodes and edges. Adding the same edge twice has no effect.
     */
    public static final class Builder {
        private final Map<CellRef, NodeState> states = new HashMap<>();
        private final Map<CellRef, Set<CellRef>> edges = new HashMap<>();
        private final Set<CellRef> formulaCells = new HashSet<>();

        /**
         * Adds a node, or updates its state. A populated state always wins over
         * {@link NodeState#EMPTY} and {@link NodeState#MISSING}; {@code MISSING}
         * wins over {@code EMPTY}.
         *
         * @param cell coordinate
         * @param state state
         * @return this builder
         */
        public Builder addNode(CellRef cell, NodeState state) {
            states.merge(cell, state, Builder::stronger);
            return this;
        }

        /**
         * Adds a populated cell holding a formula.
         *
         * @param cell coordinate
         * @param state {@link NodeState#FORMULA}, or {@link NodeState#ERROR} when the cached value is an error
         * @return this builder
         */
        public Builder addFormulaNode(CellRef cell, NodeState state) {
            formulaCells.add(cell);
            return addNode(cell, state);
        }

        /**
         * Adds the edge {@code from -> to}. Both nodes must already exist.
         *
         * @param from precedent
         * @param to dependent
         * @return this builder
         */
        public Builder addEdge(CellRef from, CellRef to) {
            requireNode(from);
            requireNode(to);
            edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
            return this;
        }

        public boolean hasNode(CellRef cell) {
            return states.containsKey(cell);
        }

        public DependencyGraph build() {
            TreeMap<CellRef, NodeState> sorted = new TreeMap<>(states);
            int n = sorted.size();
            CellRef[] cells = new CellRef[n];
            NodeState[] nodeStates = new NodeState[n];
            boolean[] formulaFlags = new boolean[n];
            Map<CellRef, Integer> ids = new HashMap<>(n * 2);
            int next = 0;
            for (Map.Entry<CellRef, NodeState> entry : sorted.entrySet()) {
                cells[next] = entry.getKey();
                nodeStates[next] = entry.getValue();
                formulaFlags[next] = entry.getValue() == NodeState.FORMULA || formulaCells.contains(entry.getKey());
                ids.put(entry.getKey(), next);
                next++;
            }

            List<List<Integer>> out = new ArrayList<>(n);
            List<List<Integer>> in = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(new ArrayList<>());
                in.add(new ArrayList<>());
            }
            int edgeCount = 0;
            for (Map.Entry<CellRef, Set<CellRef>> entry : edges.entrySet()) {
                int from = ids.get(entry.getKey());
                for (CellRef target : entry.getValue()) {
                    int to = ids.get(target);
                    out.get(from).add(to);
                    in.get(to).add(from);
                    edgeCount++;
                }
            }

            int[] childOffset = new int[n + 1];
            int[] children = new int[edgeCount];
            int[] parentOffset = new int[n + 1];
            int[] parents = new int[edgeCount];
            fill(out, childOffset, children);
            fill(in, parentOffset, parents);

            return new DependencyGraph(cells, nodeStates, formulaFlags, Collections.unmodifiableMap(ids),
                childOffset, children, parentOffset, parents);
        }

        private static void fill(List<List<Integer>> adjacency, int[] offset, int[] flat) {
            int position = 0;
            for (int i = 0; i < adjacency.size(); i++) {
                offset[i] = position;
                List<Integer> list = adjacency.get(i);
                Collections.sort(list);
                for (int target : list) {
                    flat[position++] = target;
                }
            }
            offset[adjacency.size()] = position;
        }

        private void requireNode(CellRef cell) {
            if (!states.containsKey(cell)) {
                throw new IllegalArgumentException("Unknown node: " + cell);
            }
        }

        private static NodeState stronger(NodeState current, NodeState candidate) {
            return rank(candidate) > rank(current) ? candidate : current;
        }

        private static int rank(NodeState state) {
            return switch (state) {
                case EMPTY -> 0;
                case MISSING -> 1;
                default -> 2;
            };
        }
    }
}
