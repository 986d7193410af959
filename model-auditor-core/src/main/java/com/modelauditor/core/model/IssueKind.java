package com.modelauditor.core.model;

/**
 * Category of an audit finding.
 */
public enum IssueKind {
    HARD_CODED_PLUG("Hard-coded Plug"),
    BALANCE_SHEET_IMBALANCE("Balance Sheet Imbalance"),
    BROKEN_REFERENCE("Broken Reference"),
    EXTERNAL_REFERENCE("External Reference"),
    CIRCULAR_REFERENCE("Circular Reference"),
    ORPHANED_REGION("Orphaned Region");

    private final String label;

    IssueKind(String label) {
        this.label = label;
    }

    /**
     * Returns the label shown in reports.
     *
     * @return human-readable label
     */
    public String label() {
        return label;
    }
}
