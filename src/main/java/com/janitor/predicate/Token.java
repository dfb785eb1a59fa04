package com.janitor.predicate;

/**
 * Represents a token in a predicate expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed literal value (identifier name, string, number or JSON value)
 * @param position Position in the input string
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
