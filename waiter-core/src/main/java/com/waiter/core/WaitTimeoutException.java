package com.waiter.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

/**
 * Raised when a poll run hits its timeout or attempt limit before the predicate was satisfied.
 *
 * <p>The last result is optional: when every attempt ended in an ignored exception there is none,
 * which is distinct from an attempt that returned {@code null}.
 */
public class WaitTimeoutException extends RuntimeException {
    private final String waiterName;
    private final long callsCount;
    private final List<Object> results;
    private final long elapsedNanos;

    public WaitTimeoutException(String waiterName, long callsCount, List<?> results, long elapsedNanos) {
        super(message(waiterName, callsCount, results, elapsedNanos));
        this.waiterName = waiterName;
        this.callsCount = callsCount;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.elapsedNanos = elapsedNanos;
    }

    public String waiterName() { return waiterName; }
    public long callsCount() { return callsCount; }
    public List<Object> results() { return results; }
    public Duration elapsed() { return Duration.ofNanos(elapsedNanos); }

    public boolean hasLastResult() {
        return !results.isEmpty();
    }

    /** @throws NoSuchElementException if no attempt produced a value */
    public Object lastResult() {
        if (results.isEmpty()) throw new NoSuchElementException("No attempt produced a result");
        return results.get(results.size() - 1);
    }

    private static String message(String name, long calls, List<?> results, long elapsedNanos) {
        String tail = results.isEmpty()
            ? "no results"
            : "last result " + results.get(results.size() - 1);
        return String.format("Waiter '%s' timed out after %d action calls in %d ms with %s",
            name, calls, TimeUnit.NANOSECONDS.toMillis(elapsedNanos), tail);
    }
}
