package com.modelauditor.core.report;

import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ComplexityScore;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.GraphStats;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueExplanation;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.ParseWarning;
import com.modelauditor.core.model.Severity;

import java.util.List;

/**
 * Shared audit results for report generator tests.
 */
public final class ReportFixtures {

    public static final String PLUG_ID = "0123456789abcdef";
    public static final String IMBALANCE_ID = "fedcba9876543210";

    private ReportFixtures() {
    }

    public static Issue plug() {
        return new Issue(PLUG_ID, IssueKind.HARD_CODED_PLUG, Severity.HIGH, ConfidenceLevel.HIGH,
            "Hard-coded value 5000 at Model!F2 in a row of 4 projection formulas",
            List.of(
                new Evidence(CellRef.of("Model", "F2"), "5000", null),
                new Evidence(CellRef.of("Model", "E2"), "1100", "=E1*10")),
            new IssueExplanation("Projections stop responding to drivers.",
                "A forecast value was typed over a formula.",
                "Restore the row formula."));
    }

    public static Issue imbalance() {
        return new Issue(IMBALANCE_ID, IssueKind.BALANCE_SHEET_IMBALANCE, Severity.CRITICAL, ConfidenceLevel.MEDIUM,
            "Balance sheet does not balance in column C | FY2024",
            List.of(new Evidence(CellRef.of("Balance Sheet", "C5"), "100", "=SUM(C2:C4)")),
            IssueExplanation.none());
    }

    public static GraphStats stats() {
        return new GraphStats(2, 40, 10, 28, 2, 41, 12, 1, 3, 4, 5, 6, 0, 7, 2);
    }

    public static AuditReport report() {
        return new AuditReport("model.xlsx", List.of("Model", "Balance Sheet"), true,
            List.of(imbalance(), plug()),
            new ComplexityScore(3, List.of("Formula count 600 > 500")),
            stats(),
            List.of(new ParseWarning(CellRef.of("Model", "A9"), "=SUM(A1", "Could not tokenize formula")),
            List.of(Diagnostic.info("hard-coded-plug", "No projection columns recognised on sheet 'Notes'")));
    }

    public static AuditReport clean() {
        return new AuditReport("clean.xlsx", List.of("Model"), true, List.of(),
            null, null, List.of(), List.of());
    }
}
