package com.modelauditor.core.model;

import java.util.Objects;

/**
 * One cell cited by a finding.
 *
 * @param cell coordinate
 * @param value displayed value at audit time (empty string when blank or missing)
 * @param formula formula text, or null for literal and missing cells
 */
public record Evidence(
    CellRef cell,
    String value,
    String formula
) {
    /**
     * Compact constructor with validation.
     */
    public Evidence {
        Objects.requireNonNull(cell, "cell must not be null");
        if (value == null) {
            value = "";
        }
    }

    /**
     * Builds evidence from a snapshot cell.
     *
     * @param record cell record
     * @return evidence citing the record's value and formula
     */
    public static Evidence of(CellRecord record) {
        return new Evidence(record.ref(), record.value().display(), record.formula().orElse(null));
    }

    /**
     * Builds evidence for a coordinate absent from the snapshot.
     *
     * @param cell coordinate
     * @return evidence with no value and no formula
     */
    public static Evidence missing(CellRef cell) {
        return new Evidence(cell, "", null);
    }
}
