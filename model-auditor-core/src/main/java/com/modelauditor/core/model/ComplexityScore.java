package com.modelauditor.core.model;

import java.util.List;

/**
 * Complexity rating on a 1-5 scale.
 *
 * @param value score between {@link #MIN} and {@link #MAX}
 * @param drivers breakpoints that set the score, e.g. "Sheet count 12 > 8"
 */
public record ComplexityScore(
    int value,
    List<String> drivers
) {
    public static final int MIN = 1;
    public static final int MAX = 5;

    /**
     * Compact constructor with validation.
     */
    public ComplexityScore {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("score must be between 1 and 5: " + value);
        }
        drivers = drivers == null ? List.of() : List.copyOf(drivers);
    }

    /**
     * Lowest tier with no drivers.
     *
     * @return score of 1
     */
    public static ComplexityScore lowest() {
        return new ComplexityScore(MIN, List.of());
    }

    /**
     * Returns the drivers joined for display.
     *
     * @return comma-separated drivers, or "Simple structure"
     */
    public String rationale() {
        return drivers.isEmpty() ? "Simple structure" : String.join(", ", drivers);
    }
}
