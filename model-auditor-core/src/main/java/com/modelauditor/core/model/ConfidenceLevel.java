package com.modelauditor.core.model;

/**
 * How much a finding can be trusted.
 *
 * <p>A finding starts at {@link #HIGH}. Heuristic detectors may emit
 * {@link #MEDIUM}; any finding whose evidence touches a formula that could not be
 * tokenized is lowered one level, because the graph around that cell is incomplete.
 */
public enum ConfidenceLevel {
    HIGH("Structural", 1.0),
    MEDIUM("Heuristic", 0.7),
    LOW("Incomplete parse", 0.4);

    private final String description;
    private final double weight;

    ConfidenceLevel(String description, double weight) {
        this.description = description;
        this.weight = weight;
    }

    public String getDescription() {
        return description;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Returns the next lower level, or {@link #LOW} when already lowest.
     *
     * @return downgraded level
     */
    public ConfidenceLevel downgrade() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }

    /**
     * Returns true if this confidence level is at least the specified level.
     *
     * @param minimum minimum acceptable confidence level
     * @return true if this level >= minimum level
     */
    public boolean isAtLeast(ConfidenceLevel minimum) {
        return this.weight >= minimum.weight;
    }
}
