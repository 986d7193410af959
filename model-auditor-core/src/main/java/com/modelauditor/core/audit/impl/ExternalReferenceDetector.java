package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AbstractDetector;
import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.formula.ExternalReference;
import com.modelauditor.core.formula.ParsedFormula;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports formulas that read from other workbooks or file paths, one issue per cell.
 */
public class ExternalReferenceDetector extends AbstractDetector {

    @Override
    public String getId() {
        return "external-reference";
    }

    @Override
    public String getDisplayName() {
        return "External Reference Detector";
    }

    @Override
    public int getPriority() {
        return 80;
    }

    @Override
    public boolean appliesTo(AuditContext context) {
        return context.workbook().formulasAvailable();
    }

    @Override
    public DetectorResult detect(AuditContext context) {
        List<Issue> issues = new ArrayList<>();
        Set<String> referenced = new LinkedHashSet<>();

        for (Map.Entry<CellRef, ParsedFormula> entry : context.build().formulas().entrySet()) {
            List<ExternalReference> externals = entry.getValue().externalReferences();
            if (externals.isEmpty()) {
                continue;
            }
            Set<String> books = new LinkedHashSet<>();
            externals.forEach(ref -> books.add(ref.workbook()));
            referenced.addAll(books);

            String message = "Formula at " + entry.getKey().toA1() + " depends on external workbook"
                + (books.size() == 1 ? " " : "s ") + String.join(", ", books);
            issues.add(issue(IssueKind.EXTERNAL_REFERENCE, Severity.MEDIUM, ConfidenceLevel.HIGH,
                message, List.of(context.evidence(entry.getKey())), null));
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        long unused = context.workbook().externalWorkbooks().stream()
            .filter(book -> !book.isEmpty() && !referenced.contains(book))
            .count();
        if (unused > 0) {
            diagnostics.add(info("Workbook keeps " + unused + " external link(s) that no formula uses"));
        }
        return result(issues, diagnostics);
    }
}
