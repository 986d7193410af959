package com.modelauditor.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Error tokens a spreadsheet stores in place of a value.
 */
public enum SpreadsheetError {
    NULL("#NULL!"),
    DIV_ZERO("#DIV/0!"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NUM("#NUM!"),
    NA("#N/A"),
    SPILL("#SPILL!"),
    CALC("#CALC!"),
    GETTING_DATA("#GETTING_DATA");

    private final String token;

    SpreadsheetError(String token) {
        this.token = token;
    }

    /**
     * Returns the token as displayed in a cell, e.g. {@code #DIV/0!}.
     *
     * @return display token
     */
    public String token() {
        return token;
    }

    /**
     * Looks up an error by its display token (case-insensitive, surrounding blanks ignored).
     *
     * @param text candidate token
     * @return matching error, or empty
     */
    public static Optional<SpreadsheetError> fromToken(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String candidate = text.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(e -> e.token.equals(candidate))
            .findFirst();
    }

    /**
     * Returns true when the reference or name an error signals is broken,
     * as opposed to an arithmetic or data error.
     *
     * @return true for {@link #REF} and {@link #NAME}
     */
    public boolean isReferenceError() {
        return this == REF || this == NAME;
    }
}
