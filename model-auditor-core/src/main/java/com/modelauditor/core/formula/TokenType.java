package com.modelauditor.core.formula;

/**
 * Lexical category of a formula token.
 */
public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    /** Cell, range, whole row/column or sheet-prefixed name, including any sheet or workbook prefix. */
    REFERENCE,
    /** Unprefixed identifier that is not a function call: a defined name or a LET/LAMBDA variable. */
    NAME,
    FUNCTION,
    /** Table reference such as {@code Sales[Amount]}; treated opaquely. */
    STRUCTURED_REFERENCE,
    OPERATOR,
    OPEN_PAREN,
    CLOSE_PAREN,
    ARRAY_OPEN,
    ARRAY_CLOSE,
    SEPARATOR
}
