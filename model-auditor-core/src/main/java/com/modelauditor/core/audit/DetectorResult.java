package com.modelauditor.core.audit;

import com.modelauditor.core.model.Diagnostic;
import com.modelauditor.core.model.Issue;

import java.util.List;
import java.util.Objects;

/**
 * Output of one {@link AuditDetector}.
 *
 * @param detectorId id of the detector that produced this result
 * @param success false when the detector failed
 * @param issues structural findings
 * @param diagnostics notes, such as a heuristic that found nothing to check
 */
public record DetectorResult(
    String detectorId,
    boolean success,
    List<Issue> issues,
    List<Diagnostic> diagnostics
) {
    public DetectorResult {
        Objects.requireNonNull(detectorId, "detectorId must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static DetectorResult empty(String detectorId) {
        return new DetectorResult(detectorId, true, List.of(), List.of());
    }

    public static DetectorResult of(String detectorId, List<Issue> issues, List<Diagnostic> diagnostics) {
        return new DetectorResult(detectorId, true, issues, diagnostics);
    }

    /**
     * Result of a detector that threw.
     *
     * @param detectorId detector id
     * @param message failure message
     * @return failed result carrying an ERROR diagnostic
     */
    public static DetectorResult failed(String detectorId, String message) {
        return new DetectorResult(detectorId, false, List.of(),
            List.of(Diagnostic.error(detectorId, "Detector failed: " + message)));
    }

    public boolean hasFindings() {
        return !issues.isEmpty();
    }
}
