package com.modelauditor.core.audit;

import com.modelauditor.core.model.IssueExplanation;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.SpreadsheetError;

import java.util.EnumMap;
import java.util.Map;

/**
 * Why each kind of issue matters, what usually causes it and how to fix it.
 */
public final class IssueExplanations {

    private static final Map<IssueKind, IssueExplanation> BY_KIND = new EnumMap<>(IssueKind.class);
    private static final Map<SpreadsheetError, String> ERROR_CAUSES = new EnumMap<>(SpreadsheetError.class);

    static {
        BY_KIND.put(IssueKind.EXTERNAL_REFERENCE, new IssueExplanation(
            "Links to other files break when the model is opened on another machine, turning into #REF! "
                + "errors, and they pull in numbers that can change without the model being updated.",
            "Usually left behind by paste-link from another workbook, or by formulas reading a market data "
                + "feed or a shared drive directly.",
            "Paste historical inputs as values. For live sources, document the origin and route them through "
                + "a dedicated inputs sheet."));
        BY_KIND.put(IssueKind.BROKEN_REFERENCE, new IssueExplanation(
            "Errors propagate: every cell that depends on an error cell shows an error too, which can silently "
                + "break valuation outputs and key metrics.",
            "A formula points at something that no longer exists or cannot be evaluated.",
            "Trace the error to its first occurrence with the spreadsheet's error tracing and fix that cell. "
                + "Wrapping formulas in IFERROR hides the problem instead of fixing it."));
        BY_KIND.put(IssueKind.HARD_CODED_PLUG, new IssueExplanation(
            "A number typed into a row of projection formulas forces a result. Changes to assumptions no longer "
                + "flow through that period, and the output can mislead without any warning.",
            "Typically inserted to make a model balance or hit an expected figure instead of fixing the logic, "
                + "or left over from a rushed update.",
            "Work out what the cell should calculate and write that formula. If the formula gives an unexpected "
                + "result, trace upstream for the real cause. Keep genuine assumptions on an inputs sheet."));
        BY_KIND.put(IssueKind.BALANCE_SHEET_IMBALANCE, new IssueExplanation(
            "Assets must equal liabilities plus equity in every period. An imbalance means a structural error: "
                + "a cash flow is not routed correctly or an account is missing its other side.",
            "Common causes are working capital changes missing from the cash flow statement, debt or equity "
                + "issuance not hitting both cash and the funding account, and retained earnings not linked to "
                + "net income.",
            "Add a balance check row (assets minus liabilities minus equity) for every period, find the first "
                + "period that is off, and trace every entry made in it."));
        BY_KIND.put(IssueKind.CIRCULAR_REFERENCE, new IssueExplanation(
            "A circular reference makes results depend on iteration settings. Models become fragile and slow, "
                + "may fail to converge, and are very hard to audit.",
            "Most often interest expense computed on average debt, which depends on cash, which depends on net "
                + "income, which includes the interest expense. Revolver modelling is a frequent source.",
            "Use opening balances instead of averages, or isolate the loop behind an explicit switch. Document "
                + "any circularity that is intentional."));
        BY_KIND.put(IssueKind.ORPHANED_REGION, new IssueExplanation(
            "Formulas that neither read other cells nor feed anything are dead weight. They are often stale "
                + "calculations a reader may still trust.",
            "Left behind when a section was rebuilt elsewhere, or typed constants disguised as formulas such "
                + "as =1000.",
            "Delete the region, or link it into the model if its result is still needed. Move real constants "
                + "to an inputs sheet."));

        ERROR_CAUSES.put(SpreadsheetError.REF, "A formula references a cell that was deleted, or a range that became invalid.");
        ERROR_CAUSES.put(SpreadsheetError.NAME, "A function name is misspelt, or a named range does not exist.");
        ERROR_CAUSES.put(SpreadsheetError.VALUE, "A formula received the wrong type of argument, such as text where a number is expected.");
        ERROR_CAUSES.put(SpreadsheetError.DIV_ZERO, "A formula divides by zero or by an empty cell.");
        ERROR_CAUSES.put(SpreadsheetError.NA, "A lookup did not find its key, or NA() was used as a placeholder.");
        ERROR_CAUSES.put(SpreadsheetError.NUM, "A calculation produced a number that is too large, too small, or undefined, such as an IRR that does not converge.");
        ERROR_CAUSES.put(SpreadsheetError.NULL, "Two ranges separated by a space do not intersect.");
        ERROR_CAUSES.put(SpreadsheetError.SPILL, "A dynamic array result is blocked by cells that are not empty.");
        ERROR_CAUSES.put(SpreadsheetError.CALC, "A dynamic array function could not produce a result, for example an empty FILTER.");
        ERROR_CAUSES.put(SpreadsheetError.GETTING_DATA, "The value was still being fetched from an external source when the file was saved.");
    }

    private IssueExplanations() {
        // Utility class
    }

    /**
     * Returns the standard explanation for an issue kind.
     *
     * @param kind issue kind
     * @return explanation
     */
    public static IssueExplanation forKind(IssueKind kind) {
        return BY_KIND.getOrDefault(kind, IssueExplanation.none());
    }

    /**
     * Returns the broken-reference explanation with the cause of a specific error token.
     *
     * @param error error token found in the cell
     * @return explanation
     */
    public static IssueExplanation forError(SpreadsheetError error) {
        IssueExplanation base = forKind(IssueKind.BROKEN_REFERENCE);
        return new IssueExplanation(base.why(), ERROR_CAUSES.getOrDefault(error, "Unknown error type."), base.fix());
    }

    /**
     * Returns the broken-reference explanation for a reference to a cell or sheet
     * that does not exist.
     *
     * @return explanation
     */
    public static IssueExplanation forDanglingReference() {
        IssueExplanation base = forKind(IssueKind.BROKEN_REFERENCE);
        return new IssueExplanation(base.why(),
            "A formula points at an empty cell it reads directly, or at a sheet the workbook does not contain.",
            base.fix());
    }
}
