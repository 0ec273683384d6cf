package com.faultguard.common;

import java.util.List;
import java.util.Set;

/**
 * Decides whether an error belongs to a class of failures (transient for a retry executor,
 * counted by a circuit breaker). Callers supply one per downstream dependency.
 */
@FunctionalInterface
public interface ErrorClassifier {

    boolean matches(Throwable error);

    /** Matches every error. Default for both retry and breaker. */
    static ErrorClassifier all() {
        return error -> true;
    }

    /**
     * Matches errors that are instances of any of the given types (subclasses included).
     */
    @SafeVarargs
    static ErrorClassifier anyOf(Class<? extends Throwable>... types) {
        if (types == null || types.length == 0) {
            throw new IllegalArgumentException("At least one error type required");
        }
        List<Class<? extends Throwable>> copy = List.of(types);
        return error -> error != null && copy.stream().anyMatch(t -> t.isInstance(error));
    }

    /**
     * Matches errors whose kind (see {@link ErrorKinds#kindOf(Throwable)}) is one of the given names.
     */
    static ErrorClassifier kinds(String... kinds) {
        if (kinds == null || kinds.length == 0) {
            throw new IllegalArgumentException("At least one error kind required");
        }
        Set<String> names = Set.of(kinds);
        return error -> error != null && names.contains(ErrorKinds.kindOf(error));
    }

    default ErrorClassifier negate() {
        return error -> !matches(error);
    }

    default ErrorClassifier or(ErrorClassifier other) {
        return error -> matches(error) || other.matches(error);
    }
}
