package com.modelauditor.core.graph;

import com.modelauditor.core.formula.ParsedFormula;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ParseWarning;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Output of {@link DependencyGraphBuilder}.
 *
 * @param graph the dependency graph
 * @param formulas parsed formula per formula cell, in {@link CellRef} order
 * @param warnings formulas that could not be fully understood, in {@link CellRef} order
 */
public record BuildResult(
    DependencyGraph graph,
    SortedMap<CellRef, ParsedFormula> formulas,
    List<ParseWarning> warnings
) {
    public BuildResult {
        Objects.requireNonNull(graph, "graph must not be null");
        formulas = Collections.unmodifiableSortedMap(new TreeMap<>(formulas));
        warnings = List.copyOf(warnings);
    }

    public Optional<ParsedFormula> parsed(CellRef cell) {
        return Optional.ofNullable(formulas.get(cell));
    }

    /**
     * Returns the cells carrying a parse warning.
     *
     * @return warned cells
     */
    public Set<CellRef> warnedCells() {
        return warnings.stream().map(ParseWarning::cell).collect(Collectors.toUnmodifiableSet());
    }

}
