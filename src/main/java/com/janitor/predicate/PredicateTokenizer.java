package com.janitor.predicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.janitor.exception.PredicateException;

import java.util.ArrayList;
import java.util.List;

import static com.janitor.predicate.PredicateSyntax.Operators;

/**
 * Tokenizer for predicate expressions.
 * Converts input string into a sequence of tokens.
 */
public final class PredicateTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public PredicateTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by {@link TokenType#EOF}
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.LEFT_BRACKET -> {
                    advance();
                    tokens.add(new Token(TokenType.LBRACKET, "[", null, start));
                }
                case Operators.RIGHT_BRACKET -> {
                    advance();
                    tokens.add(new Token(TokenType.RBRACKET, "]", null, start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case Operators.DOT -> {
                    advance();
                    tokens.add(new Token(TokenType.DOT, ".", null, start));
                }
                case Operators.STAR -> {
                    advance();
                    tokens.add(new Token(TokenType.STAR, "*", null, start));
                }
                case Operators.AT -> {
                    advance();
                    tokens.add(new Token(TokenType.AT, "@", null, start));
                }
                case Operators.EQUALS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.EQ, "==", null, start));
                    } else {
                        throw error("Unexpected '=' (use '==')", start);
                    }
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.NOT, "!", null, start));
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", null, start));
                    }
                }
                case Operators.AMPERSAND -> {
                    advance();
                    if (match(Operators.AMPERSAND)) {
                        tokens.add(new Token(TokenType.AND, "&&", null, start));
                    } else {
                        throw error("Unexpected '&' (use '&&')", start);
                    }
                }
                case Operators.PIPE -> {
                    advance();
                    if (match(Operators.PIPE)) {
                        tokens.add(new Token(TokenType.OR, "||", null, start));
                    } else {
                        throw error("Pipe expressions are not supported (use '||')", start);
                    }
                }
                case Operators.QUOTE_DOUBLE -> tokens.add(readQuotedIdentifier());
                case Operators.QUOTE_SINGLE -> tokens.add(readRawString());
                case Operators.BACKTICK -> tokens.add(readJsonLiteral());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifier());
                    } else if (isNumberStart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readIdentifier() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        return new Token(TokenType.IDENT, text, text, start);
    }

    private Token readNumber() {
        int start = pos;

        if (peek() == Operators.MINUS) {
            advance();
        }

        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        try {
            return new Token(TokenType.NUMBER, text, Long.parseLong(text), start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token readQuotedIdentifier() {
        int start = pos;
        String value = readDelimited(Operators.QUOTE_DOUBLE, "Unterminated quoted identifier");
        return new Token(TokenType.QUOTED_IDENT, input.substring(start, pos), value, start);
    }

    private Token readRawString() {
        int start = pos;
        String value = readDelimited(Operators.QUOTE_SINGLE, "Unterminated raw string");
        return new Token(TokenType.RAW_STRING, input.substring(start, pos), value, start);
    }

    private Token readJsonLiteral() {
        int start = pos;
        String json = readDelimited(Operators.BACKTICK, "Unterminated JSON literal");
        try {
            Object value = Values.objectMapper.readValue(json, Object.class);
            return new Token(TokenType.JSON_LITERAL, input.substring(start, pos), value, start);
        } catch (JsonProcessingException e) {
            throw new PredicateException("Invalid predicate at position " + start
                    + ": malformed JSON literal `" + json + "` in '" + input + "'", e);
        }
    }

    private String readDelimited(char quote, String unterminatedMessage) {
        int start = pos;
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error(unterminatedMessage, start);
        }

        advance(); // closing quote
        return sb.toString();
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == Operators.MINUS;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private PredicateException error(String message, int position) {
        return new PredicateException("Invalid predicate at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
