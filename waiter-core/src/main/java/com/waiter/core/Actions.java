package com.waiter.core;

import java.util.Objects;
import java.util.function.Supplier;

/** Binds call arguments once so the poll loop only ever sees a zero-argument {@link Action}. */
public final class Actions {
    private Actions() {}

    public static <T> Action<T> of(Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return supplier::get;
    }

    public static <A, T> Action<T> bind(ThrowingFn<? super A, ? extends T> fn, A arg) {
        Objects.requireNonNull(fn, "fn");
        return () -> fn.apply(arg);
    }

    public static <A, B, T> Action<T> bind(ThrowingBiFn<? super A, ? super B, ? extends T> fn, A first, B second) {
        Objects.requireNonNull(fn, "fn");
        return () -> fn.apply(first, second);
    }
}
