package com.janitor.predicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.janitor.exception.PredicateException;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Truthiness, equality and type naming for document values.
 */
public final class Values {

    static final ObjectMapper objectMapper = new ObjectMapper();

    private Values() {
    }

    /**
     * JSON text of a value; strings are returned unchanged.
     */
    public static String toJsonString(Object value) {
        if (value instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PredicateException("Cannot render value as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Truthiness used by operators inside an expression:
     * false, null, empty string, empty list and empty map are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    /**
     * Coerce the final result of a predicate into a match decision.
     * Booleans are returned as-is; strings, lists and maps match when non-empty;
     * numbers, null and any other type never match.
     */
    public static boolean toMatch(Object result) {
        if (result instanceof Boolean b) {
            return b;
        }
        if (result instanceof String s) {
            return !s.isEmpty();
        }
        if (result instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (result instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return false;
    }

    /**
     * Structural equality; numbers compare by value regardless of their boxed type.
     */
    public static boolean deepEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (a instanceof List<?> left && b instanceof List<?> right) {
            if (left.size() != right.size()) {
                return false;
            }
            Iterator<?> it = right.iterator();
            for (Object element : left) {
                if (!deepEquals(element, it.next())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> left && b instanceof Map<?, ?> right) {
            if (left.size() != right.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : left.entrySet()) {
                if (!right.containsKey(entry.getKey())
                        || !deepEquals(entry.getValue(), right.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * JSON type name of a value.
     */
    public static String typeOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
