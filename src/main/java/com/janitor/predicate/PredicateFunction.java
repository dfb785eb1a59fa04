package com.janitor.predicate;

import com.janitor.exception.PredicateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in functions of the predicate language.
 * Wrong argument types raise {@link PredicateException} at evaluation time.
 */
public enum PredicateFunction {

    STARTS_WITH("starts_with", 2, 2) {
        @Override
        Object invoke(List<Object> args) {
            return requireString(args, 0).startsWith(requireString(args, 1));
        }
    },

    ENDS_WITH("ends_with", 2, 2) {
        @Override
        Object invoke(List<Object> args) {
            return requireString(args, 0).endsWith(requireString(args, 1));
        }
    },

    CONTAINS("contains", 2, 2) {
        @Override
        Object invoke(List<Object> args) {
            Object subject = args.get(0);
            Object search = args.get(1);
            if (subject instanceof String s) {
                return search instanceof String needle && s.contains(needle);
            }
            if (subject instanceof List<?> list) {
                for (Object element : list) {
                    if (Values.deepEquals(element, search)) {
                        return true;
                    }
                }
                return false;
            }
            throw typeError(0, "string or array", subject);
        }
    },

    LENGTH("length", 1, 1) {
        @Override
        Object invoke(List<Object> args) {
            Object subject = args.get(0);
            if (subject instanceof String s) {
                return (long) s.codePointCount(0, s.length());
            }
            if (subject instanceof List<?> list) {
                return (long) list.size();
            }
            if (subject instanceof Map<?, ?> map) {
                return (long) map.size();
            }
            throw typeError(0, "string, array or object", subject);
        }
    },

    NOT_NULL("not_null", 1, Integer.MAX_VALUE) {
        @Override
        Object invoke(List<Object> args) {
            for (Object arg : args) {
                if (arg != null) {
                    return arg;
                }
            }
            return null;
        }
    },

    TO_STRING("to_string", 1, 1) {
        @Override
        Object invoke(List<Object> args) {
            return Values.toJsonString(args.get(0));
        }
    },

    TYPE("type", 1, 1) {
        @Override
        Object invoke(List<Object> args) {
            return Values.typeOf(args.get(0));
        }
    },

    KEYS("keys", 1, 1) {
        @Override
        Object invoke(List<Object> args) {
            if (args.get(0) instanceof Map<?, ?> map) {
                List<Object> keys = new ArrayList<>();
                for (Object key : map.keySet()) {
                    keys.add(String.valueOf(key));
                }
                return keys;
            }
            throw typeError(0, "object", args.get(0));
        }
    };

    private final String functionName;
    private final int minArgs;
    private final int maxArgs;

    PredicateFunction(String functionName, int minArgs, int maxArgs) {
        this.functionName = functionName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    abstract Object invoke(List<Object> args);

    public String functionName() {
        return functionName;
    }

    /**
     * Check an argument count at compile time.
     *
     * @return null when valid, otherwise a description of the problem
     */
    public String checkArity(int count) {
        if (count < minArgs || count > maxArgs) {
            String expected = minArgs == maxArgs
                    ? String.valueOf(minArgs)
                    : maxArgs == Integer.MAX_VALUE ? "at least " + minArgs : minArgs + ".." + maxArgs;
            return "function " + functionName + "() expects " + expected + " argument(s), got " + count;
        }
        return null;
    }

    public Object apply(List<Object> args) {
        return invoke(args);
    }

    public static Optional<PredicateFunction> byName(String name) {
        for (PredicateFunction function : values()) {
            if (function.functionName.equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    private static String requireString(List<Object> args, int index) {
        Object value = args.get(index);
        if (value instanceof String s) {
            return s;
        }
        throw typeError(index, "string", value);
    }

    private static PredicateException typeError(int index, String expected, Object actual) {
        return new PredicateException("argument " + (index + 1) + " must be " + expected
                + ", got " + Values.typeOf(actual));
    }
}
