package com.waiter.core;

/** Monotonic time source in nanoseconds; only differences between reads are meaningful. */
@FunctionalInterface
public interface Ticker {
    Ticker SYSTEM = System::nanoTime;

    long read();
}
