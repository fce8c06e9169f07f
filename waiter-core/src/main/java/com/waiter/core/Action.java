package com.waiter.core;

/** Zero-argument operation polled by a {@link Waiter}; invoked once per attempt. */
@FunctionalInterface
public interface Action<T> {
    T call() throws Exception;
}
