package com.modelauditor.core;

import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.AuditEngine;
import com.modelauditor.core.audit.AuditFindings;
import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.graph.BuildResult;
import com.modelauditor.core.graph.DependencyGraphBuilder;
import com.modelauditor.core.graph.GraphAnalyzer;
import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.ComplexityScore;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.GraphStats;
import com.modelauditor.core.score.ComplexityScorer;
import com.modelauditor.core.workbook.WorkbookLoaders;
import com.modelauditor.core.workbook.WorkbookSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a full audit: load, build the dependency graph, analyze it, run the
 * detectors and score complexity.
 *
 * <p>Every stage is a pure function of the snapshot and the configuration, so
 * auditing the same workbook twice yields equal reports.
 */
public class AuditPipeline {

    private static final Logger log = LoggerFactory.getLogger(AuditPipeline.class);

    private final AuditConfig config;
    private final AuditEngine engine;

    public AuditPipeline(AuditConfig config) {
        this(config, AuditEngine.withDiscoveredDetectors(config));
    }

    public AuditPipeline(AuditConfig config, AuditEngine engine) {
        this.config = config == null ? AuditConfig.defaults() : config;
        this.engine = engine;
    }

    /**
     * Loads and audits a workbook file. Value-only formats are accepted and audited
     * without the formula-based checks.
     *
     * @param file workbook path
     * @return audit report
     * @throws com.modelauditor.core.workbook.WorkbookLoadException if the file cannot be read
     */
    public AuditReport audit(Path file) {
        return audit(file, false);
    }

    /**
     * Loads and audits a workbook file.
     *
     * @param file workbook path
     * @param requireFormulas fail on value-only formats instead of auditing their values
     * @return audit report
     * @throws com.modelauditor.core.workbook.WorkbookLoadException if the file cannot be read,
     *         or carries no formulas while they are required
     */
    public AuditReport audit(Path file, boolean requireFormulas) {
        log.info("Loading workbook: {}", file);
        WorkbookSnapshot snapshot = WorkbookLoaders.forPath(file, requireFormulas).load(file);
        return audit(snapshot);
    }

    /**
     * Audits an already loaded workbook.
     *
     * @param snapshot workbook snapshot
     * @return audit report
     */
    public AuditReport audit(WorkbookSnapshot snapshot) {
        BuildResult build = new DependencyGraphBuilder(config.parser()).build(snapshot);
        GraphAnalyzer analyzer = new GraphAnalyzer(build.graph(), snapshot.sheetNames().size());
        log.info("Built dependency graph: {} nodes, {} edges", build.graph().nodeCount(), build.graph().edgeCount());

        AuditFindings findings = engine.run(new AuditContext(snapshot, build, analyzer, config));
        GraphStats stats = analyzer.stats();
        ComplexityScore score = ComplexityScorer.score(stats);

        List<Diagnostic> diagnostics = new ArrayList<>(snapshot.diagnostics());
        diagnostics.addAll(findings.diagnostics());

        log.info("Audit of {} complete: {} issue(s), complexity {}/5",
            snapshot.workbookName(), findings.issues().size(), score.value());
        return new AuditReport(snapshot.workbookName(), snapshot.sheetNames(), snapshot.formulasAvailable(),
            findings.issues(), score, stats, build.warnings(), diagnostics);
    }

    public AuditConfig getConfig() {
        return config;
    }

    public AuditEngine getEngine() {
        return engine;
    }
}
