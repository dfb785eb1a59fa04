package com.janitor.predicate;

/**
 * Operator symbols and reserved names of the predicate language.
 */
public final class PredicateSyntax {

    private PredicateSyntax() {
    }

    /**
     * Key under which context facts are injected into the evaluation document.
     */
    public static final String CONTEXT_KEY = "_context";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char DOT = '.';
        public static final char STAR = '*';
        public static final char AT = '@';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKTICK = '`';
        public static final char BACKSLASH = '\\';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
