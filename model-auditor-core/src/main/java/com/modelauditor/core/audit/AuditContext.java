package com.modelauditor.core.audit;

import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.formula.ParsedFormula;
import com.modelauditor.core.graph.BuildResult;
import com.modelauditor.core.graph.DependencyGraph;
import com.modelauditor.core.graph.GraphAnalyzer;
import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.workbook.WorkbookSnapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything a detector may read. All members are immutable or only compute
 * cached derived data, so detectors may share one context across threads.
 *
 * @param workbook loaded workbook
 * @param build dependency graph and parsed formulas
 * @param analyzer structural analysis of the graph
 * @param config audit configuration
 */
public record AuditContext(
    WorkbookSnapshot workbook,
    BuildResult build,
    GraphAnalyzer analyzer,
    AuditConfig config
) {
    public AuditContext {
        Objects.requireNonNull(workbook, "workbook must not be null");
        Objects.requireNonNull(build, "build must not be null");
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        if (config == null) {
            config = AuditConfig.defaults();
        }
    }

    public DependencyGraph graph() {
        return build.graph();
    }

    public Optional<CellRecord> cell(CellRef ref) {
        return workbook.cell(ref);
    }

    public Optional<ParsedFormula> parsed(CellRef ref) {
        return build.parsed(ref);
    }

    /**
     * Returns evidence for a cell: its value and formula when populated, a bare
     * coordinate otherwise.
     *
     * @param ref coordinate
     * @return evidence
     */
    public Evidence evidence(CellRef ref) {
        return workbook.cell(ref).map(Evidence::of).orElseGet(() -> Evidence.missing(ref));
    }
}
