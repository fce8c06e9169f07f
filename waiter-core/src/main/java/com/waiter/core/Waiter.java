package com.waiter.core;

import com.waiter.core.metrics.NoopWaitMetrics;
import com.waiter.core.metrics.WaitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Polls an action until a predicate over its result holds, bounded by a timeout, an attempt limit or both.
 *
 * <p>Before every attempt the waiter sleeps the scheduled delay, clamped to the time left before the
 * timeout, so the last attempt lands on the deadline instead of being skipped. Limits are checked
 * before each attempt; a slow action can still run past the timeout.
 *
 * <p>Exceptions matched by the policy's ignore matcher consume an attempt and are otherwise dropped.
 * Any other exception from the action, or from the predicate, aborts the run and is rethrown as is.
 * {@link InterruptedException} is never ignored.
 *
 * <p>Each run keeps its own counters; the outcome of the most recent run is exposed through
 * {@link #lastReport()}.
 */
public final class Waiter<T> {
    private static final Logger log = LoggerFactory.getLogger(Waiter.class);

    private final String name;
    private final Action<T> action;
    private final WaitPolicy policy;
    private final WaitMetrics metrics;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final int retainResults;

    private volatile PollReport<T> lastReport;

    private Waiter(Builder<T> b) {
        this.name = b.name;
        this.action = b.action;
        this.policy = b.policy.build();
        this.metrics = b.metrics;
        this.sleeper = b.sleeper;
        this.ticker = b.ticker;
        this.retainResults = b.retainResults;
    }

    public static <T> Builder<T> of(Action<T> action) {
        return new Builder<>(action);
    }

    public static <A, T> Builder<T> of(ThrowingFn<? super A, ? extends T> fn, A arg) {
        return new Builder<T>(Actions.bind(fn, arg));
    }

    public static <A, B, T> Builder<T> of(ThrowingBiFn<? super A, ? super B, ? extends T> fn, A first, B second) {
        return new Builder<T>(Actions.bind(fn, first, second));
    }

    public String name() { return name; }
    public WaitPolicy policy() { return policy; }

    // ---- predicate shorthands ----
    public T until() throws Exception { return poll(Conditions.truthy()); }

    /** Polls until {@code predicate} holds; a {@code null} predicate means truthiness. */
    public T until(Predicate<? super T> predicate) throws Exception {
        return poll(predicate == null ? Conditions.truthy() : predicate);
    }

    public T untilNot() throws Exception { return poll(Conditions.falsy()); }
    public T untilFalsy() throws Exception { return untilNot(); }

    public T untilEqualTo(Object expected) throws Exception { return poll(Conditions.equalTo(expected)); }
    public T untilNotEqualTo(Object unexpected) throws Exception { return poll(Conditions.notEqualTo(unexpected)); }

    public T untilTrue() throws Exception { return poll(Conditions.isTrue()); }
    public T untilIsTrue() throws Exception { return untilTrue(); }
    public T untilFalse() throws Exception { return poll(Conditions.isFalse()); }
    public T untilIsFalse() throws Exception { return untilFalse(); }

    public T untilNull() throws Exception { return poll(Conditions.isNull()); }
    public T untilIsNone() throws Exception { return untilNull(); }
    public T untilNotNull() throws Exception { return poll(Conditions.notNull()); }
    public T untilIsNotNone() throws Exception { return untilNotNull(); }

    // ---- poll loop ----
    /**
     * Runs one poll. Returns the first result satisfying {@code predicate}.
     *
     * @throws WaitTimeoutException when a limit is reached first
     * @throws Exception whatever the action or predicate raised, unless ignored
     */
    public T poll(Predicate<? super T> predicate) throws Exception {
        Objects.requireNonNull(predicate, "predicate");
        String runId = newRunId();
        WaitMetrics.RunScope scope = metrics.onPollStart(name, runId);

        List<T> results = retainResults == 0 ? new ArrayList<>() : new LinkedList<>();
        long callsCount = 0;
        long timeoutNanos = policy.timeoutNanos();
        long start = ticker.read();

        try {
            while (true) {
                long remaining = timeoutNanos - (ticker.read() - start);
                if (policy.hasTimeout() && remaining < 0) break;
                if (policy.hasMaxAttempts() && callsCount >= policy.maxAttempts()) break;

                long delay = policy.delayNanos(callsCount);
                long sleepNanos = policy.hasTimeout() ? Math.min(delay, remaining) : delay;
                if (sleepNanos > 0) sleeper.sleep(sleepNanos);

                callsCount++;
                scope.onAttempt(callsCount, sleepNanos);
                T result;
                try {
                    result = action.call();
                } catch (InterruptedException ie) {
                    throw ie;
                } catch (Exception ex) {
                    if (!policy.ignore().matches(ex)) throw ex;
                    if (log.isDebugEnabled()) log.debug("waiter '{}' attempt {} ignored {}", name, callsCount, ex.toString());
                    scope.onIgnoredError(callsCount, ex);
                    continue;
                }

                if (retainResults != 0 && results.size() == retainResults) results.remove(0);
                results.add(result);
                boolean satisfied = predicate.test(result);
                scope.onResult(callsCount, satisfied);
                if (satisfied) {
                    long elapsed = ticker.read() - start;
                    publish(PollReport.Outcome.SATISFIED, callsCount, results, elapsed);
                    log.debug("waiter '{}' satisfied after {} action calls", name, callsCount);
                    scope.onPollEnd(true, callsCount, elapsed, null);
                    return result;
                }
            }
        } catch (Exception | Error ex) {
            long elapsed = ticker.read() - start;
            publish(PollReport.Outcome.ABORTED, callsCount, results, elapsed);
            log.debug("waiter '{}' aborted after {} action calls", name, callsCount, ex);
            scope.onPollEnd(false, callsCount, elapsed, ex);
            throw ex;
        }

        long elapsed = ticker.read() - start;
        publish(PollReport.Outcome.TIMED_OUT, callsCount, results, elapsed);
        WaitTimeoutException timeout = new WaitTimeoutException(name, callsCount, results, elapsed);
        log.debug(timeout.getMessage());
        scope.onPollEnd(false, callsCount, elapsed, timeout);
        throw timeout;
    }

    // ---- diagnostics of the most recent run ----
    /** Report of the most recent finished run, or {@code null} before the first run. */
    public PollReport<T> lastReport() { return lastReport; }

    public long callsCount() {
        PollReport<T> r = lastReport;
        return r == null ? 0 : r.callsCount();
    }

    /**
     * Values observed by the most recent run, oldest first. Every value is kept unless the builder's
     * {@code retainResults} bounds the list; a long run with a short interval grows it without limit.
     */
    public List<T> results() {
        PollReport<T> r = lastReport;
        return r == null ? List.of() : r.results();
    }

    private void publish(PollReport.Outcome outcome, long callsCount, List<T> results, long elapsedNanos) {
        lastReport = new PollReport<>(outcome, callsCount, results, elapsedNanos);
    }

    private static String newRunId() {
        long r = ThreadLocalRandom.current().nextLong();
        return Long.toHexString(System.nanoTime()) + "-" + Long.toHexString(r);
    }

    @Override
    public String toString() {
        return "Waiter[" + name + ", " + policy + "]";
    }

    public static final class Builder<T> {
        private final Action<T> action;
        private String name = "waiter";
        private WaitPolicy.Builder policy = WaitPolicy.builder();
        private WaitMetrics metrics = NoopWaitMetrics.INSTANCE;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Ticker ticker = Ticker.SYSTEM;
        private int retainResults = 0;

        private Builder(Action<T> action) {
            this.action = Objects.requireNonNull(action, "action");
        }

        public Builder<T> name(String n) {
            if (n == null || n.isBlank()) throw new IllegalArgumentException("name must be non-empty");
            this.name = n;
            return this;
        }

        /** Replaces every policy setting made so far; later setters still override single fields. */
        public Builder<T> policy(WaitPolicy p) { this.policy = Objects.requireNonNull(p, "policy").toBuilder(); return this; }

        public Builder<T> timeout(Duration d) { policy.timeout(d); return this; }
        public Builder<T> maxAttempts(int n) { policy.maxAttempts(n); return this; }
        public Builder<T> interval(Duration d) { policy.interval(d); return this; }
        public Builder<T> exponential(boolean b) { policy.exponential(b); return this; }
        public Builder<T> exponential() { return exponential(true); }
        public Builder<T> maxInterval(Duration d) { policy.maxInterval(d); return this; }
        public Builder<T> ignore(ExceptionMatcher matcher) { policy.ignore(matcher); return this; }

        @SafeVarargs
        public final Builder<T> ignoring(Class<? extends Exception>... types) { policy.ignoring(types); return this; }

        public Builder<T> metrics(WaitMetrics m) { this.metrics = (m == null) ? NoopWaitMetrics.INSTANCE : m; return this; }
        public Builder<T> sleeper(Sleeper s) { this.sleeper = Objects.requireNonNull(s, "sleeper"); return this; }
        public Builder<T> ticker(Ticker t) { this.ticker = Objects.requireNonNull(t, "ticker"); return this; }

        /** Keeps only the last {@code limit} results of a run; 0 keeps all of them. */
        public Builder<T> retainResults(int limit) {
            if (limit < 0) throw new WaiterConfigurationException("retainResults must be >= 0: " + limit);
            this.retainResults = limit;
            return this;
        }

        /**
         * @throws UnlimitedWaiterException when neither timeout nor maxAttempts is set
         * @throws UnusedMaxIntervalException when maxInterval is set without exponential backoff
         * @throws WaiterConfigurationException for negative limits or delays
         */
        public Waiter<T> build() {
            return new Waiter<>(this);
        }
    }
}
