package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AbstractDetector;
import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.graph.Cycle;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports each circular reference once, citing every cell of the cycle.
 */
public class CircularReferenceDetector extends AbstractDetector {

    private static final int MAX_LISTED_CELLS = 6;

    @Override
    public String getId() {
        return "circular-reference";
    }

    @Override
    public String getDisplayName() {
        return "Circular Reference Detector";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public DetectorResult detect(AuditContext context) {
        List<Cycle> cycles = context.analyzer().detectCycles();
        if (cycles.isEmpty()) {
            return emptyResult();
        }

        List<Issue> issues = new ArrayList<>();
        for (Cycle cycle : cycles) {
            List<Evidence> evidence = cycle.members().stream().map(context::evidence).toList();
            issues.add(issue(IssueKind.CIRCULAR_REFERENCE, Severity.HIGH, ConfidenceLevel.HIGH,
                message(cycle), evidence, null));
        }
        log.debug("Found {} circular references", issues.size());
        return result(issues, List.of());
    }

    private static String message(Cycle cycle) {
        if (cycle.isSelfLoop()) {
            return "Cell " + cycle.first().toA1() + " references itself";
        }
        String cells = cycle.members().stream()
            .limit(MAX_LISTED_CELLS)
            .map(CellRef::toA1)
            .collect(Collectors.joining(", "));
        String more = cycle.size() > MAX_LISTED_CELLS ? " and " + (cycle.size() - MAX_LISTED_CELLS) + " more" : "";
        return "Circular reference through " + cycle.size() + " cells: " + cells + more;
    }
}
