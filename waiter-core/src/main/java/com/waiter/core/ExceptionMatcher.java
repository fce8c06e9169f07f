package com.waiter.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether an exception raised by the action is swallowed for the current attempt.
 */
@FunctionalInterface
public interface ExceptionMatcher {
    ExceptionMatcher NONE = e -> false;

    boolean matches(Exception exception);

    default ExceptionMatcher or(ExceptionMatcher other) {
        Objects.requireNonNull(other, "other");
        if (this == NONE) return other;
        if (other == NONE) return this;
        return e -> matches(e) || other.matches(e);
    }

    /** Matches instances of any of the given types, subclasses included. */
    @SafeVarargs
    static ExceptionMatcher anyOf(Class<? extends Exception>... types) {
        if (types == null) return NONE;
        return anyOf(Arrays.asList(types));
    }

    static ExceptionMatcher anyOf(List<Class<? extends Exception>> types) {
        Objects.requireNonNull(types, "types");
        if (types.isEmpty()) return NONE;
        List<Class<? extends Exception>> copy = new ArrayList<>(types.size());
        for (var t : types) copy.add(Objects.requireNonNull(t, "exception type"));
        return new TypeMatcher(List.copyOf(copy));
    }

    /** Type-set matcher; kept as a named class so policies stay comparable and printable. */
    record TypeMatcher(List<Class<? extends Exception>> types) implements ExceptionMatcher {
        public TypeMatcher {
            types = List.copyOf(Objects.requireNonNull(types, "types"));
        }

        @Override
        public boolean matches(Exception exception) {
            for (var t : types) {
                if (t.isInstance(exception)) return true;
            }
            return false;
        }
    }
}
