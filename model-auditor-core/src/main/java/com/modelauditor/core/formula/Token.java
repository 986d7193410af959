package com.modelauditor.core.formula;

import java.util.Objects;

/**
 * One lexical token of a formula.
 *
 * @param type category
 * @param text source text; function names are upper-cased
 * @param position offset of the first character in the formula body
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean is(TokenType candidate) {
        return type == candidate;
    }
}
