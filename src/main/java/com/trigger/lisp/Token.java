package com.trigger.lisp;

/**
 * Represents a token in rule source.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed literal value (for strings, numbers, booleans)
 * @param position Offset in the source
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
