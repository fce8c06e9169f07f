package com.waiter.core;

@FunctionalInterface
public interface ThrowingBiFn<A, B, T> {
    T apply(A first, B second) throws Exception;
}
