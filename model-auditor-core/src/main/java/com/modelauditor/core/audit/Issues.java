package com.modelauditor.core.audit;

import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.util.IdGenerator;

/**
 * Deterministic issue identifiers.
 */
public final class Issues {

    private Issues() {
        // Utility class
    }

    /**
     * Derives the id of an issue: 16 hex characters of the SHA-256 of the kind, the
     * primary cell and an optional discriminator. The same finding on the same
     * workbook always gets the same id.
     *
     * @param kind issue kind
     * @param primary primary evidence cell
     * @param discriminator extra key for kinds that can report several issues at one
     *                      cell, or null
     * @return issue id
     */
    public static String idFor(IssueKind kind, CellRef primary, String discriminator) {
        if (discriminator == null || discriminator.isEmpty()) {
            return IdGenerator.generate(kind.name(), primary.toA1());
        }
        return IdGenerator.generate(kind.name(), primary.toA1(), discriminator);
    }

    public static String idFor(IssueKind kind, CellRef primary) {
        return idFor(kind, primary, null);
    }
}
