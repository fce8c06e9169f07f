package com.waiter.core;

@FunctionalInterface
public interface ThrowingFn<A, T> {
    T apply(A arg) throws Exception;
}
