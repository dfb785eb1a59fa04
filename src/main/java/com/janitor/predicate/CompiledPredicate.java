package com.janitor.predicate;

import com.janitor.exception.PredicateException;
import com.janitor.predicate.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed predicate, immutable and safe to share between worker threads.
 */
public final class CompiledPredicate {

    private static final Logger log = LoggerFactory.getLogger(CompiledPredicate.class);

    private final String expression;
    private final Node root;

    CompiledPredicate(String expression, Node root) {
        this.expression = expression;
        this.root = root;
    }

    /**
     * Evaluate against a document and return the raw result value.
     *
     * @throws PredicateException if evaluation fails
     */
    public Object search(Object document) {
        return root.evaluate(document);
    }

    /**
     * Evaluate against a document and coerce the result to a match decision.
     * Evaluation errors never escape: they make the predicate non-matching.
     */
    public boolean matches(Object document) {
        try {
            return Values.toMatch(search(document));
        } catch (PredicateException e) {
            log.debug("Predicate '{}' failed to evaluate: {}", expression, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Unexpected error evaluating predicate '{}'", expression, e);
            return false;
        }
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
