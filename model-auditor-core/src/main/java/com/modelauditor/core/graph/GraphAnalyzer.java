package com.modelauditor.core.graph;

import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.GraphStats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structural analysis of a {@link DependencyGraph}: circular references, orphaned
 * formulas, depth, inputs and outputs, and summary statistics.
 *
 * <p>Strongly connected components are found once, with an iterative Tarjan
 * traversal, and cached. Depth is the longest path, in edges, from any node with no
 * precedents; it is computed over the condensation so cycles never cause infinite
 * walks. Members of a cycle have no depth.
 */
public class GraphAnalyzer {

    private final DependencyGraph graph;
    private final int sheetCount;

    private int[] component;
    private List<int[]> components;
    private List<Cycle> cycles;
    private int[] depth;

    /**
     * Creates an analyzer that counts the sheets holding populated cells.
     *
     * @param graph graph to analyze
     */
    public GraphAnalyzer(DependencyGraph graph) {
        this(graph, -1);
    }

    /**
     * Creates an analyzer.
     *
     * @param graph graph to analyze
     * @param sheetCount number of sheets in the workbook, or -1 to count populated sheets
     */
    public GraphAnalyzer(DependencyGraph graph, int sheetCount) {
        this.graph = graph;
        this.sheetCount = sheetCount;
    }

    public DependencyGraph graph() {
        return graph;
    }

    /**
     * Returns one {@link Cycle} per strongly connected component with more than one
     * member, plus one per self-referencing cell, ordered by first member.
     *
     * @return circular references
     */
    public List<Cycle> detectCycles() {
        ensureComponents();
        return cycles;
    }

    /**
     * Returns formula cells that reference nothing and are referenced by nothing.
     *
     * @return orphaned formula cells, sorted
     */
    public SortedSet<CellRef> findOrphans() {
        SortedSet<CellRef> orphans = new TreeSet<>();
        for (int id = 0; id < graph.nodeCount(); id++) {
            if (graph.isFormula(id) && graph.inDegree(id) == 0 && graph.outDegree(id) == 0) {
                orphans.add(graph.cell(id));
            }
        }
        return Collections.unmodifiableSortedSet(orphans);
    }

    /**
     * Returns the longest path, in edges, from any node without precedents to the cell.
     *
     * @param cell cell
     * @return depth, or empty for cells on a cycle and cells not in the graph
     */
    public OptionalInt depth(CellRef cell) {
        int id = graph.id(cell);
        if (id < 0) {
            return OptionalInt.empty();
        }
        ensureDepth();
        return depth[id] < 0 ? OptionalInt.empty() : OptionalInt.of(depth[id]);
    }

    /**
     * Returns non-formula cells that feed at least one formula and have no precedents.
     *
     * @return leaf inputs, sorted
     */
    public List<CellRef> leafInputs() {
        List<CellRef> result = new ArrayList<>();
        for (int id = 0; id < graph.nodeCount(); id++) {
            if (!graph.isFormula(id) && graph.inDegree(id) == 0 && graph.outDegree(id) > 0) {
                result.add(graph.cell(id));
            }
        }
        return result;
    }

    /**
     * Returns formula cells nothing else references.
     *
     * @return terminal outputs, sorted
     */
    public List<CellRef> terminalOutputs() {
        List<CellRef> result = new ArrayList<>();
        for (int id = 0; id < graph.nodeCount(); id++) {
            if (graph.isFormula(id) && graph.outDegree(id) == 0) {
                result.add(graph.cell(id));
            }
        }
        return result;
    }

    /**
     * Summarizes the graph.
     *
     * @return statistics
     */
    public GraphStats stats() {
        ensureDepth();
        int populated = 0;
        int formulas = 0;
        int literals = 0;
        int errors = 0;
        int missing = 0;
        int crossSheet = 0;
        int maxDepth = 0;
        int maxFanIn = 0;
        int maxFanOut = 0;
        int leaves = 0;
        int terminals = 0;
        TreeSet<String> sheets = new TreeSet<>();

        for (int id = 0; id < graph.nodeCount(); id++) {
            NodeState state = graph.state(id);
            if (state.isPopulated()) {
                populated++;
                sheets.add(graph.cell(id).sheet());
            }
            if (graph.isFormula(id)) {
                formulas++;
            }
            switch (state) {
                case LITERAL -> literals++;
                case ERROR -> errors++;
                case MISSING -> missing++;
                default -> {
                    // counted above
                }
            }
            int in = graph.inDegree(id);
            int out = graph.outDegree(id);
            maxFanIn = Math.max(maxFanIn, in);
            maxFanOut = Math.max(maxFanOut, out);
            maxDepth = Math.max(maxDepth, depth[id]);
            if (!graph.isFormula(id) && in == 0 && out > 0) {
                leaves++;
            }
            if (graph.isFormula(id) && out == 0) {
                terminals++;
            }
            String sheet = graph.cell(id).sheet();
            for (int i = 0; i < out; i++) {
                if (!graph.cell(graph.child(id, i)).sheet().equals(sheet)) {
                    crossSheet++;
                }
            }
        }

        return new GraphStats(
            sheetCount >= 0 ? sheetCount : sheets.size(),
            populated, formulas, literals, errors,
            graph.nodeCount(), graph.edgeCount(), missing, crossSheet,
            maxDepth, maxFanIn, maxFanOut,
            detectCycles().size(), leaves, terminals);
    }

    private void ensureComponents() {
        if (components != null) {
            return;
        }
        int n = graph.nodeCount();
        component = new int[n];
        Arrays.fill(component, -1);
        components = new ArrayList<>();

        int[] index = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        int[] stack = new int[n];
        int stackTop = 0;
        int[] callStack = new int[n];
        int[] nextChild = new int[n];
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) {
                continue;
            }
            int callTop = 0;
            callStack[callTop++] = root;
            index[root] = low[root] = counter++;
            stack[stackTop++] = root;
            onStack[root] = true;

            while (callTop > 0) {
                int v = callStack[callTop - 1];
                if (nextChild[v] < graph.outDegree(v)) {
                    int w = graph.child(v, nextChild[v]++);
                    if (index[w] < 0) {
                        index[w] = low[w] = counter++;
                        stack[stackTop++] = w;
                        onStack[w] = true;
                        callStack[callTop++] = w;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                callTop--;
                if (callTop > 0) {
                    int parent = callStack[callTop - 1];
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    int start = stackTop - 1;
                    while (stack[start] != v) {
                        start--;
                    }
                    int[] members = Arrays.copyOfRange(stack, start, stackTop);
                    for (int w : members) {
                        onStack[w] = false;
                        component[w] = components.size();
                    }
                    stackTop = start;
                    components.add(members);
                }
            }
        }

        List<Cycle> found = new ArrayList<>();
        for (int[] members : components) {
            boolean cyclic = members.length > 1 || graph.hasEdge(graph.cell(members[0]), graph.cell(members[0]));
            if (cyclic) {
                List<CellRef> cells = new ArrayList<>(members.length);
                for (int member : members) {
                    cells.add(graph.cell(member));
                }
                found.add(new Cycle(cells));
            }
        }
        found.sort((a, b) -> a.first().compareTo(b.first()));
        cycles = List.copyOf(found);
    }

    private void ensureDepth() {
        if (depth != null) {
            return;
        }
        ensureComponents();
        int n = graph.nodeCount();
        int[] componentDepth = new int[components.size()];

        // Tarjan emits components in reverse topological order
        for (int c = components.size() - 1; c >= 0; c--) {
            int best = 0;
            for (int member : components.get(c)) {
                for (int i = 0; i < graph.inDegree(member); i++) {
                    int parent = graph.parent(member, i);
                    int parentComponent = component[parent];
                    if (parentComponent != c) {
                        best = Math.max(best, componentDepth[parentComponent] + 1);
                    }
                }
            }
            componentDepth[c] = best;
        }

        boolean[] cyclic = new boolean[components.size()];
        for (Cycle cycle : cycles) {
            cyclic[component[graph.id(cycle.first())]] = true;
        }

        depth = new int[n];
        for (int id = 0; id < n; id++) {
            depth[id] = cyclic[component[id]] ? -1 : componentDepth[component[id]];
        }
    }
}
