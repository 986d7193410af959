package com.modelauditor.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Result of one audit run, handed to report generators and the narrative layer.
 *
 * @param workbookName file name of the audited workbook
 * @param sheets sheet names in workbook order
 * @param formulasAvailable false when the input carried values only
 * @param issues findings in report order
 * @param score complexity score
 * @param stats graph statistics
 * @param parseWarnings formulas that could not be fully parsed
 * @param diagnostics notes from stages and detectors
 */
public record AuditReport(
    String workbookName,
    List<String> sheets,
    boolean formulasAvailable,
    List<Issue> issues,
    ComplexityScore score,
    GraphStats stats,
    List<ParseWarning> parseWarnings,
    List<Diagnostic> diagnostics
) {
    public static final String NO_ISSUES_MESSAGE = "No structural issues found";

    /**
     * Compact constructor with validation.
     */
    public AuditReport {
        Objects.requireNonNull(workbookName, "workbookName must not be null");
        sheets = sheets == null ? List.of() : List.copyOf(sheets);
        issues = issues == null ? List.of() : List.copyOf(issues);
        if (score == null) {
            score = ComplexityScore.lowest();
        }
        if (stats == null) {
            stats = GraphStats.empty();
        }
        parseWarnings = parseWarnings == null ? List.of() : List.copyOf(parseWarnings);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    /**
     * Counts findings per severity, every severity present.
     *
     * @return severity to count, ascending severity order
     */
    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new TreeMap<>();
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        counts.putAll(issues.stream().collect(Collectors.groupingBy(Issue::severity, Collectors.counting())));
        return counts;
    }

    /**
     * Returns issues at or above a severity.
     *
     * @param minimum threshold
     * @return matching issues in report order
     */
    public List<Issue> issuesAtLeast(Severity minimum) {
        return issues.stream().filter(i -> i.severity().isAtLeast(minimum)).toList();
    }

    /**
     * One-line verdict for the top of a report.
     *
     * @return summary sentence
     */
    public String summaryLine() {
        if (issues.isEmpty()) {
            return NO_ISSUES_MESSAGE;
        }
        Map<Severity, Long> counts = countBySeverity();
        return String.format("%d issue(s): %d critical, %d high, %d medium, %d low",
            issues.size(),
            counts.get(Severity.CRITICAL),
            counts.get(Severity.HIGH),
            counts.get(Severity.MEDIUM),
            counts.get(Severity.LOW));
    }
}
