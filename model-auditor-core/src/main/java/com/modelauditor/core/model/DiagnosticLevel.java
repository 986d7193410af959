package com.modelauditor.core.model;

/**
 * Level of a {@link Diagnostic}.
 */
public enum DiagnosticLevel {
    /**
     * Informational - a heuristic found nothing to work on.
     */
    INFO,

    /**
     * Warning - part of the workbook was analysed with reduced fidelity.
     */
    WARNING,

    /**
     * Error - a stage or detector failed; its findings are missing from the report.
     */
    ERROR
}
