package com.janitor.predicate.node;

import com.janitor.predicate.Values;

/**
 * Comparison of two operands. Equality is structural; ordering is defined
 * for numbers only and yields null for any other operand types.
 */
public class ComparatorNode implements Node {

    /**
     * Supported comparators.
     */
    public enum Comparator {
        EQ("=="),
        NE("!="),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<=");

        private final String symbol;

        Comparator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Comparator comparator;
    private final Node left;
    private final Node right;

    public ComparatorNode(Comparator comparator, Node left, Node right) {
        this.comparator = comparator;
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(Object current) {
        Object a = left.evaluate(current);
        Object b = right.evaluate(current);

        return switch (comparator) {
            case EQ -> Values.deepEquals(a, b);
            case NE -> !Values.deepEquals(a, b);
            case GT, GTE, LT, LTE -> compareNumbers(a, b);
        };
    }

    private Object compareNumbers(Object a, Object b) {
        if (!(a instanceof Number x) || !(b instanceof Number y)) {
            return null;
        }
        int cmp = Double.compare(x.doubleValue(), y.doubleValue());
        return switch (comparator) {
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            default -> throw new IllegalStateException("Not an ordering comparator: " + comparator);
        };
    }

    @Override
    public NodeType getType() {
        return NodeType.COMPARATOR;
    }

    @Override
    public String toString() {
        return "(" + left + " " + comparator.symbol() + " " + right + ")";
    }
}
