package com.modelauditor.core.model;

/**
 * Severity of an audit finding, lowest first.
 */
public enum Severity {
    /** Hygiene item, no effect on outputs today. */
    LOW,
    /** Fragility that can break outputs when the model changes or moves. */
    MEDIUM,
    /** Likely wrong output or logic that bypasses the model's own calculations. */
    HIGH,
    /** The model contradicts an accounting identity. */
    CRITICAL;

    /**
     * Returns true if this severity is at least the given one.
     *
     * @param minimum threshold
     * @return true when {@code this >= minimum}
     */
    public boolean isAtLeast(Severity minimum) {
        return compareTo(minimum) >= 0;
    }
}
