package com.modelauditor.core.model;

/**
 * Reader-facing context for a finding.
 *
 * @param why why the finding matters
 * @param cause what usually produces it
 * @param fix how to remediate it
 */
public record IssueExplanation(
    String why,
    String cause,
    String fix
) {
    /**
     * Compact constructor normalising nulls to empty text.
     */
    public IssueExplanation {
        why = why == null ? "" : why;
        cause = cause == null ? "" : cause;
        fix = fix == null ? "" : fix;
    }

    public static IssueExplanation none() {
        return new IssueExplanation("", "", "");
    }
}
