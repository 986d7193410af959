package com.modelauditor.core.graph;

import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.formula.FormulaParser;
import com.modelauditor.core.formula.ParsedFormula;
import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ParseWarning;
import com.modelauditor.core.workbook.WorkbookSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Turns a {@link WorkbookSnapshot} into a {@link DependencyGraph}.
 *
 * <p>Every populated cell becomes a node. Each formula is parsed and an edge is
 * added from every referenced cell to the formula cell. Referenced coordinates
 * that hold nothing become {@link NodeState#MISSING} nodes when referenced
 * directly and {@link NodeState#EMPTY} nodes when covered by a range.
 *
 * <p>Formulas may be parsed on a fixed pool; results are merged in
 * {@link CellRef} order, so the graph does not depend on scheduling.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final int maxRangeCells;
    private final int parallelism;

    public DependencyGraphBuilder() {
        this(AuditConfig.ParserConfig.defaults());
    }

    public DependencyGraphBuilder(AuditConfig.ParserConfig config) {
        this(config.maxRangeCells(), config.parallelism());
    }

    /**
     * Creates a builder.
     *
     * @param maxRangeCells cap on cells one range reference expands to
     * @param parallelism parser threads; 1 parses on the calling thread
     */
    public DependencyGraphBuilder(int maxRangeCells, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
        this.maxRangeCells = maxRangeCells;
        this.parallelism = parallelism;
    }

    /**
     * Builds the graph.
     *
     * @param snapshot loaded workbook
     * @return graph, parsed formulas and parse warnings
     */
    public BuildResult build(WorkbookSnapshot snapshot) {
        DependencyGraph.Builder graph = DependencyGraph.builder();
        for (CellRecord record : snapshot.records()) {
            if (record.hasFormula()) {
                graph.addFormulaNode(record.ref(), NodeState.of(record.kind()));
            } else {
                graph.addNode(record.ref(), NodeState.of(record.kind()));
            }
        }

        List<CellRecord> formulaCells = snapshot.formulaCells();
        FormulaParser parser = new FormulaParser(snapshot, maxRangeCells);
        TreeMap<CellRef, ParsedFormula> parsed = parseAll(parser, formulaCells);

        List<ParseWarning> warnings = new ArrayList<>();
        for (Map.Entry<CellRef, ParsedFormula> entry : parsed.entrySet()) {
            CellRef cell = entry.getKey();
            ParsedFormula formula = entry.getValue();
            for (CellRef reference : formula.references()) {
                if (!snapshot.contains(reference)) {
                    graph.addNode(reference, formula.isDirect(reference) ? NodeState.MISSING : NodeState.EMPTY);
                }
                graph.addEdge(reference, cell);
            }
            formula.warning().ifPresent(message -> warnings.add(
                new ParseWarning(cell, snapshot.formulas().get(cell).orElse(""), message)));
        }

        DependencyGraph result = graph.build();
        log.debug("Built dependency graph for {}: {} nodes, {} edges, {} parse warnings",
            snapshot.workbookName(), result.nodeCount(), result.edgeCount(), warnings.size());
        return new BuildResult(result, parsed, warnings);
    }

    private TreeMap<CellRef, ParsedFormula> parseAll(FormulaParser parser, List<CellRecord> cells) {
        TreeMap<CellRef, ParsedFormula> parsed = new TreeMap<>();
        if (parallelism == 1 || cells.size() < 2 * parallelism) {
            for (CellRecord cell : cells) {
                parsed.put(cell.ref(), parse(parser, cell));
            }
            return parsed;
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            int chunk = (cells.size() + parallelism - 1) / parallelism;
            List<Future<Map<CellRef, ParsedFormula>>> futures = new ArrayList<>();
            for (int start = 0; start < cells.size(); start += chunk) {
                List<CellRecord> slice = cells.subList(start, Math.min(cells.size(), start + chunk));
                Callable<Map<CellRef, ParsedFormula>> task = () -> {
                    Map<CellRef, ParsedFormula> part = new TreeMap<>();
                    for (CellRecord cell : slice) {
                        part.put(cell.ref(), parse(parser, cell));
                    }
                    return part;
                };
                futures.add(executor.submit(task));
            }
            for (Future<Map<CellRef, ParsedFormula>> future : futures) {
                parsed.putAll(future.get());
            }
            return parsed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing formulas", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Formula parsing failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static ParsedFormula parse(FormulaParser parser, CellRecord cell) {
        return parser.parse(cell.formula().orElse(""), cell.ref().sheet());
    }
}
