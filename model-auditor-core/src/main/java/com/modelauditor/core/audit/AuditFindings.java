package com.modelauditor.core.audit;

import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Issue;

import java.util.List;

/**
 * Merged output of all detectors of one run.
 *
 * @param issues deduplicated issues in report order
 * @param diagnostics detector notes, in detector order
 * @param executedDetectors ids of the detectors that ran
 */
public record AuditFindings(
    List<Issue> issues,
    List<Diagnostic> diagnostics,
    List<String> executedDetectors
) {
    public AuditFindings {
        issues = issues == null ? List.of() : List.copyOf(issues);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        executedDetectors = executedDetectors == null ? List.of() : List.copyOf(executedDetectors);
    }
}
