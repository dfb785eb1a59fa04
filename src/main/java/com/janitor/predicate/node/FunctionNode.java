package com.janitor.predicate.node;

import com.janitor.predicate.PredicateFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in function call, e.g. {@code starts_with(metadata.name, 'pr-')}.
 */
public class FunctionNode implements Node {

    private final PredicateFunction function;
    private final List<Node> arguments;

    public FunctionNode(PredicateFunction function, List<Node> arguments) {
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(Object current) {
        List<Object> values = new ArrayList<>(arguments.size());
        for (Node argument : arguments) {
            values.add(argument.evaluate(current));
        }
        return function.apply(values);
    }

    @Override
    public NodeType getType() {
        return NodeType.FUNCTION;
    }

    @Override
    public String toString() {
        return function.functionName() + arguments;
    }
}
