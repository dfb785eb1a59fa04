package com.janitor.predicate;

import com.janitor.exception.PredicateException;
import com.janitor.predicate.node.AndNode;
import com.janitor.predicate.node.ComparatorNode;
import com.janitor.predicate.node.CurrentNode;
import com.janitor.predicate.node.FieldNode;
import com.janitor.predicate.node.FunctionNode;
import com.janitor.predicate.node.IndexNode;
import com.janitor.predicate.node.LiteralNode;
import com.janitor.predicate.node.Node;
import com.janitor.predicate.node.NotNode;
import com.janitor.predicate.node.OrNode;
import com.janitor.predicate.node.ProjectionNode;
import com.janitor.predicate.node.SubexpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for predicate expressions.
 * Converts tokens into a {@link Node} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: || &lt; &amp;&amp; &lt; comparison &lt; ! &lt; path):
 * <pre>
 * expression := or
 * or         := and ('||' and)*
 * and        := comparison ('&amp;&amp;' comparison)*
 * comparison := unary (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') unary)?
 * unary      := '!' unary | path
 * path       := primary chain*
 * chain      := '.' (identifier | '*') | '[' number ']' | '[' '*' ']'
 * primary    := identifier | identifier '(' args ')' | '@' | raw-string | json-literal
 *             | number | '(' expression ')' | '[' number ']' | '[' '*' ']' | '*'
 * </pre>
 * A projection ({@code [*]} or {@code .*}) applies the remainder of the path to every element.
 */
public final class PredicateParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public PredicateParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a node tree.
     *
     * @return Root node
     */
    public Node parse() {
        Node result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private Node parseExpression() {
        return parseOr();
    }

    private Node parseOr() {
        Node left = parseAnd();
        while (match(TokenType.OR)) {
            left = new OrNode(left, parseAnd());
        }
        return left;
    }

    private Node parseAnd() {
        Node left = parseComparison();
        while (match(TokenType.AND)) {
            left = new AndNode(left, parseComparison());
        }
        return left;
    }

    private Node parseComparison() {
        Node left = parseUnary();

        ComparatorNode.Comparator comparator = comparatorFor(peek().type());
        if (comparator == null) {
            return left;
        }
        advance();
        Node right = parseUnary();
        return new ComparatorNode(comparator, left, right);
    }

    private Node parseUnary() {
        if (match(TokenType.NOT)) {
            return new NotNode(parseUnary());
        }
        return parsePath();
    }

    private Node parsePath() {
        Node base = parsePrimary();
        return parseChain(base);
    }

    /**
     * Parse trailing field, index and projection accessors onto the given base.
     */
    private Node parseChain(Node base) {
        Node node = base;
        while (true) {
            if (match(TokenType.DOT)) {
                if (match(TokenType.STAR)) {
                    return new ProjectionNode(node, parseChain(CurrentNode.INSTANCE), true);
                }
                node = new SubexpressionNode(node, parseFieldName());
            } else if (check(TokenType.LBRACKET)) {
                advance();
                if (match(TokenType.STAR)) {
                    expect(TokenType.RBRACKET);
                    return new ProjectionNode(node, parseChain(CurrentNode.INSTANCE), false);
                }
                Token number = consume(TokenType.NUMBER, "Expected index or '*' inside brackets");
                expect(TokenType.RBRACKET);
                node = new SubexpressionNode(node, new IndexNode(toIndex(number)));
            } else {
                return node;
            }
        }
    }

    private Node parsePrimary() {
        if (match(TokenType.LPAREN)) {
            Node expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }

        if (match(TokenType.AT)) {
            return CurrentNode.INSTANCE;
        }

        if (match(TokenType.RAW_STRING, TokenType.JSON_LITERAL, TokenType.NUMBER)) {
            return new LiteralNode(previous().literal());
        }

        if (match(TokenType.QUOTED_IDENT)) {
            return new FieldNode((String) previous().literal());
        }

        if (match(TokenType.IDENT)) {
            Token name = previous();
            if (match(TokenType.LPAREN)) {
                return parseFunctionCall(name);
            }
            return new FieldNode(name.text());
        }

        if (match(TokenType.STAR)) {
            return new ProjectionNode(CurrentNode.INSTANCE, parseChain(CurrentNode.INSTANCE), true);
        }

        if (match(TokenType.LBRACKET)) {
            if (match(TokenType.STAR)) {
                expect(TokenType.RBRACKET);
                return new ProjectionNode(CurrentNode.INSTANCE, parseChain(CurrentNode.INSTANCE), false);
            }
            Token number = consume(TokenType.NUMBER, "Expected index or '*' inside brackets");
            expect(TokenType.RBRACKET);
            return new IndexNode(toIndex(number));
        }

        throw error("Expected expression");
    }

    private Node parseFunctionCall(Token name) {
        PredicateFunction function = PredicateFunction.byName(name.text())
                .orElseThrow(() -> errorAt(name.position(), "Unknown function '" + name.text() + "'"));

        List<Node> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseExpression());
            while (match(TokenType.COMMA)) {
                arguments.add(parseExpression());
            }
        }
        expect(TokenType.RPAREN);

        String arityProblem = function.checkArity(arguments.size());
        if (arityProblem != null) {
            throw errorAt(name.position(), arityProblem);
        }
        return new FunctionNode(function, arguments);
    }

    private Node parseFieldName() {
        if (match(TokenType.IDENT)) {
            return new FieldNode(previous().text());
        }
        if (match(TokenType.QUOTED_IDENT)) {
            return new FieldNode((String) previous().literal());
        }
        throw error("Expected field name after '.'");
    }

    private int toIndex(Token number) {
        long value = (Long) number.literal();
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw errorAt(number.position(), "Index out of range");
        }
        return (int) value;
    }

    private static ComparatorNode.Comparator comparatorFor(TokenType type) {
        return switch (type) {
            case EQ -> ComparatorNode.Comparator.EQ;
            case NE -> ComparatorNode.Comparator.NE;
            case GT -> ComparatorNode.Comparator.GT;
            case GTE -> ComparatorNode.Comparator.GTE;
            case LT -> ComparatorNode.Comparator.LT;
            case LTE -> ComparatorNode.Comparator.LTE;
            default -> null;
        };
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private PredicateException error(String message) {
        return errorAt(peek().position(), message);
    }

    private PredicateException errorAt(int position, String message) {
        return new PredicateException("Invalid predicate at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
