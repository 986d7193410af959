package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AbstractDetector;
import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * Reports formulas disconnected from the rest of the model.
 *
 * <p>Orphans next to each other in one row form a single region and are reported
 * as one issue.
 */
public class OrphanedRegionDetector extends AbstractDetector {

    @Override
    public String getId() {
        return "orphaned-region";
    }

    @Override
    public String getDisplayName() {
        return "Orphaned Region Detector";
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public boolean appliesTo(AuditContext context) {
        return context.workbook().formulasAvailable();
    }

    @Override
    public DetectorResult detect(AuditContext context) {
        SortedSet<CellRef> orphans = context.analyzer().findOrphans();
        List<Issue> issues = new ArrayList<>();
        for (List<CellRef> run : runs(orphans)) {
            List<Evidence> evidence = run.stream().map(context::evidence).toList();
            String where = run.size() == 1
                ? run.get(0).toA1()
                : run.get(0).toA1() + ":" + run.get(run.size() - 1).address();
            String message = run.size() == 1
                ? "Formula at " + where + " neither reads nor feeds any other cell"
                : run.size() + " formulas at " + where + " neither read nor feed any other cell";
            issues.add(issue(IssueKind.ORPHANED_REGION, Severity.LOW, ConfidenceLevel.MEDIUM, message, evidence, null));
        }
        return result(issues, List.of());
    }

    /**
     * Groups sorted cells into runs of adjacent columns within one row.
     */
    static List<List<CellRef>> runs(SortedSet<CellRef> cells) {
        List<List<CellRef>> runs = new ArrayList<>();
        List<CellRef> current = new ArrayList<>();
        CellRef previous = null;
        for (CellRef cell : cells) {
            boolean adjacent = previous != null
                && previous.sheet().equals(cell.sheet())
                && previous.row() == cell.row()
                && previous.column() + 1 == cell.column();
            if (!adjacent && !current.isEmpty()) {
                runs.add(current);
                current = new ArrayList<>();
            }
            current.add(cell);
            previous = cell;
        }
        if (!current.isEmpty()) {
            runs.add(current);
        }
        return runs;
    }
}
