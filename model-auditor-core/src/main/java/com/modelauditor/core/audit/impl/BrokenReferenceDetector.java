package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AbstractDetector;
import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.audit.IssueExplanations;
import com.modelauditor.core.formula.ParsedFormula;
import com.modelauditor.core.graph.DependencyGraph;
import com.modelauditor.core.graph.NodeState;
import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.model.SpreadsheetError;
import com.modelauditor.core.model.TypedValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports cells that evaluate to an error token, formulas reading cells or sheets
 * that do not exist, and formulas with {@code #REF!} written into their text.
 *
 * <p>An error cell whose precedents are all error-free is the root cause and is
 * reported with HIGH severity; error cells that merely inherit an error from a
 * precedent are reported with MEDIUM severity.
 */
public class BrokenReferenceDetector extends AbstractDetector {

    private static final int MAX_LISTED_DEPENDENTS = 5;

    @Override
    public String getId() {
        return "broken-reference";
    }

    @Override
    public String getDisplayName() {
        return "Broken Reference Detector";
    }

    @Override
    public int getPriority() {
        return 90;
    }

    @Override
    public DetectorResult detect(AuditContext context) {
        List<Issue> issues = new ArrayList<>();
        DependencyGraph graph = context.graph();

        for (CellRef cell : graph.cellsIn(NodeState.ERROR)) {
            context.cell(cell).ifPresent(record -> issues.add(errorCell(context, record)));
        }
        for (CellRef cell : graph.cellsIn(NodeState.MISSING)) {
            issues.add(danglingReference(context, cell));
        }
        for (Map.Entry<CellRef, ParsedFormula> entry : context.build().formulas().entrySet()) {
            CellRef cell = entry.getKey();
            if (entry.getValue().errorLiterals().contains(SpreadsheetError.REF)
                && graph.node(cell).map(n -> n.state() != NodeState.ERROR).orElse(true)) {
                issues.add(issue(IssueKind.BROKEN_REFERENCE, Severity.HIGH, ConfidenceLevel.HIGH,
                    "Formula at " + cell.toA1() + " contains #REF!, a reference that was deleted",
                    List.of(context.evidence(cell)), "ref-literal",
                    IssueExplanations.forError(SpreadsheetError.REF)));
            }
        }
        log.debug("Found {} broken references", issues.size());
        return result(issues, List.of());
    }

    private Issue errorCell(AuditContext context, CellRecord record) {
        CellRef cell = record.ref();
        SpreadsheetError error = ((TypedValue.ErrorValue) record.value()).error();
        List<CellRef> erroredPrecedents = context.graph().precedents(cell).stream()
            .filter(p -> context.graph().node(p).map(n -> n.state() == NodeState.ERROR).orElse(false))
            .toList();

        List<Evidence> evidence = new ArrayList<>();
        evidence.add(Evidence.of(record));
        erroredPrecedents.forEach(p -> evidence.add(context.evidence(p)));

        if (erroredPrecedents.isEmpty()) {
            return issue(IssueKind.BROKEN_REFERENCE, Severity.HIGH, ConfidenceLevel.HIGH,
                "Cell " + cell.toA1() + " evaluates to " + error.token(),
                evidence, "error", IssueExplanations.forError(error));
        }
        return issue(IssueKind.BROKEN_REFERENCE, Severity.MEDIUM, ConfidenceLevel.HIGH,
            "Cell " + cell.toA1() + " shows " + error.token() + " inherited from " + erroredPrecedents.get(0).toA1(),
            evidence, "error", IssueExplanations.forError(error));
    }

    private Issue danglingReference(AuditContext context, CellRef cell) {
        List<CellRef> dependents = context.graph().dependents(cell);
        List<Evidence> evidence = new ArrayList<>();
        evidence.add(Evidence.missing(cell));
        dependents.stream().limit(MAX_LISTED_DEPENDENTS).forEach(d -> evidence.add(context.evidence(d)));

        String readers = dependents.isEmpty() ? "a formula" : dependents.get(0).toA1()
            + (dependents.size() > 1 ? " and " + (dependents.size() - 1) + " other formula(s)" : "");
        boolean sheetExists = context.workbook().sheetNames().contains(cell.sheet());
        if (!sheetExists) {
            return issue(IssueKind.BROKEN_REFERENCE, Severity.HIGH, ConfidenceLevel.HIGH,
                readers + " reference" + (dependents.size() > 1 ? "" : "s") + " sheet '" + cell.sheet()
                    + "', which is not in the workbook",
                evidence, "missing", IssueExplanations.forDanglingReference());
        }
        return issue(IssueKind.BROKEN_REFERENCE, Severity.MEDIUM, ConfidenceLevel.MEDIUM,
            readers + " read" + (dependents.size() > 1 ? "" : "s") + " empty cell " + cell.toA1(),
            evidence, "missing", IssueExplanations.forDanglingReference());
    }
}
