package com.janitor.predicate;

import com.janitor.exception.PredicateException;
import com.janitor.predicate.node.Node;

import java.util.List;

/**
 * Compiles predicate strings into reusable {@link CompiledPredicate}s.
 * <p>
 * Compilation failures (syntax errors, unknown functions, wrong arity) are
 * reported as {@link PredicateException} so that rule loading can reject them
 * before any resource is evaluated.
 */
public final class PredicateCompiler {

    private PredicateCompiler() {
    }

    /**
     * Compile an expression.
     *
     * @param expression Expression string (e.g., "metadata.labels.env == 'test'")
     * @return Compiled predicate
     * @throws PredicateException if the expression is blank or malformed
     */
    public static CompiledPredicate compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new PredicateException("Predicate expression is empty");
        }

        List<Token> tokens = new PredicateTokenizer(expression).tokenize();
        Node root = new PredicateParser(expression, tokens).parse();
        return new CompiledPredicate(expression, root);
    }
}
