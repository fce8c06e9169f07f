package com.waiter.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Static polling configuration: limits, delay schedule and the ignored-exception matcher.
 *
 * <p>A zero {@code timeout} means no time limit, a zero {@code maxAttempts} means no attempt limit and a
 * zero {@code maxInterval} means exponential delays grow without a ceiling. At least one limit must be set.
 */
public record WaitPolicy(
    Duration timeout,
    int maxAttempts,
    Duration interval,
    boolean exponential,
    Duration maxInterval,
    ExceptionMatcher ignore
) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);

    public WaitPolicy {
        timeout = Objects.requireNonNull(timeout, "timeout");
        interval = Objects.requireNonNull(interval, "interval");
        maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
        ignore = (ignore == null) ? ExceptionMatcher.NONE : ignore;

        if (timeout.isZero() && maxAttempts == 0) throw new UnlimitedWaiterException();
        if (!maxInterval.isZero() && !exponential) throw new UnusedMaxIntervalException();
        if (timeout.isNegative()) throw new WaiterConfigurationException("timeout must be >= 0: " + timeout);
        if (maxAttempts < 0) throw new WaiterConfigurationException("maxAttempts must be >= 0: " + maxAttempts);
        if (interval.isNegative()) throw new WaiterConfigurationException("interval must be >= 0: " + interval);
        if (maxInterval.isNegative()) throw new WaiterConfigurationException("maxInterval must be >= 0: " + maxInterval);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasTimeout() { return !timeout.isZero(); }
    public boolean hasMaxAttempts() { return maxAttempts != 0; }

    long timeoutNanos() { return saturatedNanos(timeout); }

    /**
     * Delay to sleep before the attempt that follows {@code callsCount} earlier attempts.
     * Exponential delays saturate at {@link Long#MAX_VALUE} instead of overflowing.
     */
    public long delayNanos(long callsCount) {
        if (callsCount < 0) throw new IllegalArgumentException("callsCount must be >= 0: " + callsCount);
        long base = saturatedNanos(interval);
        if (!exponential || base == 0) return base;

        long delay;
        if (callsCount >= Long.SIZE - 1 || base > (Long.MAX_VALUE >> (int) callsCount)) delay = Long.MAX_VALUE;
        else delay = base << (int) callsCount;

        long ceiling = saturatedNanos(maxInterval);
        return ceiling == 0 ? delay : Math.min(delay, ceiling);
    }

    public Builder toBuilder() {
        return new Builder()
            .timeout(timeout)
            .maxAttempts(maxAttempts)
            .interval(interval)
            .exponential(exponential)
            .maxInterval(maxInterval)
            .ignore(ignore);
    }

    static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return d.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    public static final class Builder {
        private Duration timeout = Duration.ZERO;
        private int maxAttempts = 0;
        private Duration interval = DEFAULT_INTERVAL;
        private boolean exponential = false;
        private Duration maxInterval = Duration.ZERO;
        private ExceptionMatcher ignore = ExceptionMatcher.NONE;

        private Builder() {}

        public Builder timeout(Duration d) { this.timeout = Objects.requireNonNull(d, "timeout"); return this; }
        public Builder maxAttempts(int n) { this.maxAttempts = n; return this; }
        public Builder interval(Duration d) { this.interval = Objects.requireNonNull(d, "interval"); return this; }
        public Builder exponential(boolean b) { this.exponential = b; return this; }
        public Builder maxInterval(Duration d) { this.maxInterval = Objects.requireNonNull(d, "maxInterval"); return this; }

        public Builder ignore(ExceptionMatcher matcher) {
            this.ignore = (matcher == null) ? ExceptionMatcher.NONE : matcher;
            return this;
        }

        /** Adds exception types to the ignore set; repeated calls accumulate. */
        @SafeVarargs
        public final Builder ignoring(Class<? extends Exception>... types) {
            this.ignore = this.ignore.or(ExceptionMatcher.anyOf(types));
            return this;
        }

        public WaitPolicy build() {
            return new WaitPolicy(timeout, maxAttempts, interval, exponential, maxInterval, ignore);
        }
    }
}
