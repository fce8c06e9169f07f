package com.waiter.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Virtual clock: sleeping advances time instantly and every sleep is recorded. */
final class FakeTime implements Ticker, Sleeper {
    private long now;
    final List<Duration> sleeps = new ArrayList<>();

    @Override
    public long read() {
        return now;
    }

    @Override
    public void sleep(long nanos) {
        sleeps.add(Duration.ofNanos(nanos));
        now += nanos;
    }

    void advance(Duration d) {
        now += d.toNanos();
    }

    Duration elapsed() {
        return Duration.ofNanos(now);
    }

    Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
