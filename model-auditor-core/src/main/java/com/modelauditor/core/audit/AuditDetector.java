package com.modelauditor.core.audit;

/**
 * Service Provider Interface for structural checks run against a workbook.
 *
 * <p>Detectors are discovered through {@link java.util.ServiceLoader}; register an
 * implementation in
 * {@code META-INF/services/com.modelauditor.core.audit.AuditDetector}.
 *
 * <p>Detectors are independent: each reads the shared {@link AuditContext} and
 * reports its own issues. They must not mutate anything they are given.
 *
 * <p><b>Implementation guidelines:</b>
 * <ul>
 *   <li>Return quickly from {@link #appliesTo(AuditContext)} when the workbook lacks
 *       what the check needs</li>
 *   <li>Report heuristics that found nothing to look at as INFO diagnostics, not issues</li>
 *   <li>Build issue ids with {@link Issues#idFor} so repeated runs agree</li>
 * </ul>
 *
 * @see AuditEngine
 * @see AbstractDetector
 */
public interface AuditDetector {

    /**
     * Returns the unique identifier used in configuration, e.g. {@code balance-sheet}.
     *
     * @return detector id
     */
    String getId();

    /**
     * Returns a human-readable name.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the execution priority; higher runs first and reports first.
     *
     * @return priority
     */
    int getPriority();

    /**
     * Checks whether the detector has anything to do for this workbook.
     *
     * @param context audit context
     * @return true if {@link #detect(AuditContext)} should run
     */
    boolean appliesTo(AuditContext context);

    /**
     * Runs the check.
     *
     * @param context audit context
     * @return issues and diagnostics
     */
    DetectorResult detect(AuditContext context);
}
