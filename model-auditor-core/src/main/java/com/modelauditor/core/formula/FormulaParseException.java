package com.modelauditor.core.formula;

/**
 * Formula text that cannot be tokenized.
 *
 * <p>Raised by {@link FormulaTokenizer}; {@link FormulaParser} converts it into a
 * warning on the parsed result and never lets it escape.
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * Returns the offset in the formula body where tokenizing stopped.
     *
     * @return character offset
     */
    public int getPosition() {
        return position;
    }
}
