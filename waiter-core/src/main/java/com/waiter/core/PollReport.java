package com.waiter.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one poll run: attempts made, values observed (ignored failures excluded) and how it ended.
 * Results may contain {@code null}s and hold every observed value unless the waiter bounds them
 * with {@code retainResults}.
 */
public record PollReport<T>(
    Outcome outcome,
    long callsCount,
    List<T> results,
    long elapsedNanos
) {
    public enum Outcome { SATISFIED, TIMED_OUT, ABORTED }

    public PollReport {
        outcome = Objects.requireNonNull(outcome, "outcome");
        if (callsCount < 0) throw new IllegalArgumentException("callsCount must be >= 0");
        results = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(results, "results")));
    }

    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos);
    }

    public boolean succeeded() {
        return outcome == Outcome.SATISFIED;
    }
}
