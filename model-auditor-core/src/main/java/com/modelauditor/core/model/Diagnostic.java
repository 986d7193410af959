package com.modelauditor.core.model;

import java.util.Objects;

/**
 * Side-channel note produced while auditing.
 *
 * <p>Diagnostics are not findings about the model. They record what the audit
 * could not do, e.g. a balance sheet that was not located or a sheet without a
 * recognisable projection region, so that a clean report can be told apart from
 * an incomplete one.
 *
 * @param source id of the stage or detector
 * @param message human-readable description
 * @param level level
 */
public record Diagnostic(
    String source,
    String message,
    DiagnosticLevel level
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(level, "level must not be null");
    }

    public static Diagnostic info(String source, String message) {
        return new Diagnostic(source, message, DiagnosticLevel.INFO);
    }

    public static Diagnostic warning(String source, String message) {
        return new Diagnostic(source, message, DiagnosticLevel.WARNING);
    }

    public static Diagnostic error(String source, String message) {
        return new Diagnostic(source, message, DiagnosticLevel.ERROR);
    }
}
