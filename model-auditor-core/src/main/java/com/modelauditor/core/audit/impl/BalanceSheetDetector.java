package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AbstractDetector;
import com.modelauditor.core.audit.AuditContext;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.audit.LabelMatcher;
import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.model.TypedValue;
import com.modelauditor.core.model.ValueType;
import com.modelauditor.core.workbook.UsedRange;
import com.modelauditor.core.workbook.WorkbookSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Checks that total assets equal total liabilities plus equity in every period.
 *
 * <p>The balance sheet is the configured sheet or the first sheet whose name matches
 * a synonym. Total rows are found by their labels in the leftmost columns; every
 * column right of the labels where total assets is numeric is a period.
 */
public class BalanceSheetDetector extends AbstractDetector {

    @Override
    public String getId() {
        return "balance-sheet";
    }

    @Override
    public String getDisplayName() {
        return "Balance Sheet Integrity Detector";
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    public DetectorResult detect(AuditContext context) {
        AuditConfig.BalanceSheetConfig config = context.config().balanceSheet();
        WorkbookSnapshot workbook = context.workbook();

        Optional<String> sheet = findSheet(workbook, config);
        if (sheet.isEmpty()) {
            return result(List.of(), List.of(info("Balance sheet not found; no sheet matches the configured names")));
        }

        TotalRows rows = findTotalRows(workbook, sheet.get(), config);
        boolean hasFunding = rows.combined > 0 || (rows.liabilities > 0 && rows.equity > 0);
        if (rows.assets == 0 || !hasFunding) {
            return result(List.of(), List.of(info("Balance sheet not found; sheet '" + sheet.get()
                + "' has no total assets and total liabilities and equity rows")));
        }

        UsedRange range = workbook.usedRange(sheet.get()).orElseThrow();
        List<Issue> issues = new ArrayList<>();
        for (int column = rows.labelColumn + 1; column <= range.lastColumn(); column++) {
            CellRef assetsCell = new CellRef(sheet.get(), rows.assets, column);
            OptionalDouble assets = workbook.valueAt(assetsCell).asNumber();
            if (assets.isEmpty()) {
                continue;
            }

            List<CellRef> fundingCells = rows.liabilities > 0 && rows.equity > 0
                ? List.of(new CellRef(sheet.get(), rows.liabilities, column), new CellRef(sheet.get(), rows.equity, column))
                : List.of(new CellRef(sheet.get(), rows.combined, column));
            double funding = 0;
            for (CellRef cell : fundingCells) {
                funding += workbook.valueAt(cell).asNumber().orElse(0);
            }

            double delta = assets.getAsDouble() - funding;
            if (Math.abs(delta) <= config.tolerance()) {
                continue;
            }
            List<Evidence> evidence = new ArrayList<>();
            evidence.add(context.evidence(assetsCell));
            fundingCells.forEach(cell -> evidence.add(context.evidence(cell)));

            String message = String.format(Locale.ROOT,
                "Balance sheet does not balance in %s: assets minus liabilities and equity is %,.2f",
                periodLabel(workbook, sheet.get(), column, rows.assets), delta);
            issues.add(issue(IssueKind.BALANCE_SHEET_IMBALANCE, Severity.CRITICAL, ConfidenceLevel.HIGH,
                message, evidence, null));
        }
        log.debug("Checked balance sheet '{}': {} imbalanced period(s)", sheet.get(), issues.size());
        return result(issues, List.of());
    }

    static Optional<String> findSheet(WorkbookSnapshot workbook, AuditConfig.BalanceSheetConfig config) {
        if (config.sheet() != null && !config.sheet().isBlank()) {
            return workbook.canonicalSheet(config.sheet());
        }
        for (String synonym : config.sheetSynonyms()) {
            for (String name : workbook.sheetNames()) {
                if (LabelMatcher.containsWords(name, synonym)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private static TotalRows findTotalRows(WorkbookSnapshot workbook, String sheet,
                                           AuditConfig.BalanceSheetConfig config) {
        TotalRows rows = new TotalRows();
        for (CellRecord record : workbook.sheetRecords(sheet)) {
            int column = record.ref().column();
            if (column > config.labelColumns() || record.value().type() != ValueType.TEXT) {
                continue;
            }
            String label = LabelMatcher.normalize(record.value().display());
            int row = record.ref().row();
            boolean found = false;
            if (rows.assets == 0 && LabelMatcher.containsAny(label, config.assetsLabels())
                && !label.contains("liabilities")) {
                rows.assets = row;
                found = true;
            } else if (rows.combined == 0 && (LabelMatcher.containsAny(label, config.combinedLabels())
                || (label.contains("total liabilities") && label.contains("equity")))) {
                rows.combined = row;
                found = true;
            } else if (rows.liabilities == 0 && LabelMatcher.containsAny(label, config.liabilitiesLabels())
                && !label.contains("equity")) {
                rows.liabilities = row;
                found = true;
            } else if (rows.equity == 0 && LabelMatcher.containsAny(label, config.equityLabels())
                && !label.contains("liabilities")) {
                rows.equity = row;
                found = true;
            }
            if (found) {
                rows.labelColumn = Math.max(rows.labelColumn, column);
            }
        }
        return rows;
    }

    /**
     * Names a period column by its topmost value above the assets row, usually the header.
     */
    private static String periodLabel(WorkbookSnapshot workbook, String sheet, int column, int assetsRow) {
        String letters = new CellRef(sheet, 1, column).columnLetters();
        for (int row = 1; row < assetsRow; row++) {
            TypedValue value = workbook.valueAt(new CellRef(sheet, row, column));
            if (!value.isEmpty()) {
                return "column " + letters + " (" + value.display() + ")";
            }
        }
        return "column " + letters;
    }

    private static final class TotalRows {
        int assets;
        int liabilities;
        int equity;
        int combined;
        int labelColumn;
    }
}
