package com.waiter.core;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/** Result predicates behind the {@code until*} shorthands of {@link Waiter}. */
public final class Conditions {
    private Conditions() {}

    /**
     * Truthiness of a polled value: {@code null}, {@code false}, zero numbers, empty text, empty
     * collections, maps and arrays, and empty {@link Optional}s are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return !isZero(n);
        if (value instanceof Character c) return c != '\0';
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof Optional<?> o) return o.isPresent();
        if (value.getClass().isArray()) return Array.getLength(value) > 0;
        return true;
    }

    public static <T> Predicate<T> truthy() { return Conditions::isTruthy; }

    public static <T> Predicate<T> falsy() { return v -> !isTruthy(v); }

    public static <T> Predicate<T> equalTo(Object expected) { return v -> Objects.equals(v, expected); }

    public static <T> Predicate<T> notEqualTo(Object unexpected) { return v -> !Objects.equals(v, unexpected); }

    /** Only a {@link Boolean} holding {@code true}; truthy values such as {@code 1} do not match. */
    public static <T> Predicate<T> isTrue() { return v -> v instanceof Boolean b && b; }

    public static <T> Predicate<T> isFalse() { return v -> v instanceof Boolean b && !b; }

    public static <T> Predicate<T> isNull() { return Objects::isNull; }

    public static <T> Predicate<T> notNull() { return Objects::nonNull; }

    private static boolean isZero(Number n) {
        if (n instanceof BigDecimal d) return d.signum() == 0;
        if (n instanceof BigInteger i) return i.signum() == 0;
        if (n instanceof Double || n instanceof Float) return n.doubleValue() == 0.0d;
        return n.longValue() == 0L;
    }
}
