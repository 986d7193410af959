package com.modelauditor.core.report.impl;

import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.GraphStats;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.ParseWarning;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Generates an audit memo in Markdown.
 *
 * <p>The memo opens with the verdict and complexity score, lists findings grouped
 * by severity with their evidence cells and remediation notes, and closes with
 * graph statistics, parse warnings and diagnostics.
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String BOLD = "**";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final String VALUES_ONLY_NOTE =
        "> The input carried values only. Formula-based checks were skipped.";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Audit Memo";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedReport generate(AuditReport report) {
        log.debug("Generating Markdown memo for {} with {} issue(s)", report.workbookName(), report.issues().size());
        StringBuilder md = new StringBuilder();

        md.append(H1).append("Model Audit: ").append(escapeMarkdown(report.workbookName())).append(DOUBLE_NEWLINE);
        md.append(BOLD).append("Verdict:").append(BOLD).append(' ').append(report.summaryLine()).append(NEWLINE);
        md.append(NEWLINE).append(BOLD).append("Complexity:").append(BOLD).append(' ')
            .append(report.score().value()).append("/5 (").append(escapeMarkdown(report.score().rationale()))
            .append(')').append(DOUBLE_NEWLINE);
        if (!report.formulasAvailable()) {
            md.append(VALUES_ONLY_NOTE).append(DOUBLE_NEWLINE);
        }

        appendIssues(md, report);
        appendStats(md, report.stats());
        appendParseWarnings(md, report.parseWarnings());
        appendDiagnostics(md, report.diagnostics());

        return new GeneratedReport("audit-report", md.toString(), getFileExtension(), "text/markdown");
    }

    private void appendIssues(StringBuilder md, AuditReport report) {
        md.append(H2).append("Findings").append(DOUBLE_NEWLINE);
        if (!report.hasIssues()) {
            md.append(AuditReport.NO_ISSUES_MESSAGE).append('.').append(DOUBLE_NEWLINE);
            return;
        }
        for (Severity severity : List.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW)) {
            List<Issue> issues = report.issues().stream().filter(i -> i.severity() == severity).toList();
            if (issues.isEmpty()) {
                continue;
            }
            md.append(H3).append(capitalize(severity.name())).append(" (").append(issues.size()).append(')')
                .append(DOUBLE_NEWLINE);
            for (Issue issue : issues) {
                appendIssue(md, issue);
            }
        }
    }

    private void appendIssue(StringBuilder md, Issue issue) {
        md.append("- ").append(BOLD).append(issue.kind().label()).append(BOLD).append(" at ")
            .append(CODE).append(issue.primaryCell().toA1()).append(CODE).append(": ")
            .append(escapeMarkdown(issue.message()))
            .append(" _(confidence: ").append(issue.confidence().name().toLowerCase(Locale.ROOT))
            .append(", id ").append(CODE).append(issue.id()).append(CODE).append(")_").append(DOUBLE_NEWLINE);

        md.append("  ").append(PIPE).append(" Cell ").append(PIPE).append(" Value ").append(PIPE)
            .append(" Formula ").append(PIPE).append(NEWLINE);
        md.append("  |---|---|---|").append(NEWLINE);
        for (Evidence evidence : issue.evidence()) {
            md.append("  ").append(PIPE).append(' ').append(escapeMarkdown(evidence.cell().toA1())).append(' ')
                .append(PIPE).append(' ').append(escapeMarkdown(evidence.value())).append(' ')
                .append(PIPE).append(' ')
                .append(evidence.formula() == null ? "" : CODE + escapeMarkdown(evidence.formula()) + CODE)
                .append(' ').append(PIPE).append(NEWLINE);
        }
        md.append(NEWLINE);

        if (!issue.explanation().why().isEmpty()) {
            md.append("  ").append(BOLD).append("Why it matters:").append(BOLD).append(' ')
                .append(issue.explanation().why()).append(NEWLINE);
            md.append("  ").append(BOLD).append("Likely cause:").append(BOLD).append(' ')
                .append(issue.explanation().cause()).append(NEWLINE);
            md.append("  ").append(BOLD).append("Fix:").append(BOLD).append(' ')
                .append(issue.explanation().fix()).append(DOUBLE_NEWLINE);
        }
    }

    private void appendStats(StringBuilder md, GraphStats stats) {
        md.append(H2).append("Model Structure").append(DOUBLE_NEWLINE);
        md.append("| Metric | Value |").append(NEWLINE);
        md.append("|---|---|").append(NEWLINE);
        row(md, "Sheets", stats.sheetCount());
        row(md, "Populated cells", stats.populatedCells());
        row(md, "Formula cells", stats.formulaCells());
        row(md, "Literal cells", stats.literalCells());
        row(md, "Error cells", stats.errorCells());
        row(md, "Dependencies", stats.edgeCount());
        row(md, "Cross-sheet dependencies", stats.crossSheetEdges());
        row(md, "Longest dependency chain", stats.maxDepth());
        row(md, "Largest fan-in", stats.maxFanIn());
        row(md, "Largest fan-out", stats.maxFanOut());
        row(md, "Circular groups", stats.cyclicComponents());
        row(md, "Input cells", stats.leafInputs());
        row(md, "Output cells", stats.terminalOutputs());
        md.append(NEWLINE);
    }

    private static void row(StringBuilder md, String metric, int value) {
        md.append(PIPE).append(' ').append(metric).append(' ').append(PIPE).append(' ').append(value)
            .append(' ').append(PIPE).append(NEWLINE);
    }

    private void appendParseWarnings(StringBuilder md, List<ParseWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        md.append(H2).append("Parse Warnings").append(DOUBLE_NEWLINE);
        md.append("Findings citing these cells carry reduced confidence.").append(DOUBLE_NEWLINE);
        for (ParseWarning warning : warnings) {
            md.append("- ").append(CODE).append(warning.cell().toA1()).append(CODE).append(": ")
                .append(escapeMarkdown(warning.message())).append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    private void appendDiagnostics(StringBuilder md, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        md.append(H2).append("Diagnostics").append(DOUBLE_NEWLINE);
        for (Diagnostic diagnostic : diagnostics) {
            md.append("- [").append(diagnostic.level()).append("] ").append(CODE).append(diagnostic.source())
                .append(CODE).append(": ").append(escapeMarkdown(diagnostic.message())).append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }

    private String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
