package com.modelauditor.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One audit finding.
 *
 * <p>The {@code id} is a hash of the kind and primary evidence coordinate (see
 * {@link com.modelauditor.core.audit.Issues#idFor}); two runs over the same
 * workbook produce the same ids, which is what deduplication and baseline diffs
 * rely on.
 *
 * @param id deterministic identifier
 * @param kind finding category
 * @param severity severity
 * @param confidence confidence in the finding
 * @param message message populated with evidence
 * @param evidence cited cells, primary cell first
 * @param explanation why/cause/fix context
 */
public record Issue(
    String id,
    IssueKind kind,
    Severity severity,
    ConfidenceLevel confidence,
    String message,
    List<Evidence> evidence,
    IssueExplanation explanation
) {
    /**
     * Report order: most severe first, then kind, then primary coordinate.
     */
    public static final Comparator<Issue> REPORT_ORDER = Comparator
        .comparing(Issue::severity, Comparator.reverseOrder())
        .thenComparing(Issue::kind)
        .thenComparing(Issue::primaryCell)
        .thenComparing(Issue::id);

    /**
     * Compact constructor with validation.
     */
    public Issue {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (confidence == null) {
            confidence = ConfidenceLevel.HIGH;
        }
        if (evidence == null || evidence.isEmpty()) {
            throw new IllegalArgumentException("issue must cite at least one cell");
        }
        evidence = List.copyOf(evidence);
        if (explanation == null) {
            explanation = IssueExplanation.none();
        }
    }

    /**
     * Returns the coordinate the finding is anchored on.
     *
     * @return first evidence cell
     */
    public CellRef primaryCell() {
        return evidence.get(0).cell();
    }

    /**
     * Returns a copy with a different confidence.
     *
     * @param level new confidence
     * @return updated issue
     */
    public Issue withConfidence(ConfidenceLevel level) {
        return new Issue(id, kind, severity, level, message, evidence, explanation);
    }

    /**
     * Returns true if any evidence cell is the given coordinate.
     *
     * @param cell coordinate
     * @return true when cited
     */
    public boolean cites(CellRef cell) {
        return evidence.stream().anyMatch(e -> e.cell().equals(cell));
    }
}
