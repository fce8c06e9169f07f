package com.waiter.core;

import java.util.concurrent.TimeUnit;

/** Pause between attempts. Swappable so tests can run without real sleeping. */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = nanos -> { if (nanos > 0) TimeUnit.NANOSECONDS.sleep(nanos); };

    void sleep(long nanos) throws InterruptedException;
}
