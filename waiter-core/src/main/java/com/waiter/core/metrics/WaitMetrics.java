package com.waiter.core.metrics;

/** Minimal metrics sink for waiters.
 *  Implementations may push to logs, Micrometer, etc.
 */
public interface WaitMetrics {
  /** Called at the start of a poll run. */
  RunScope onPollStart(String waiterName, String runId);

  /** A per-run scope for attempt-level and end-of-run events. */
  interface RunScope {
    /** Called after sleeping, right before the action is invoked. */
    void onAttempt(long attempt, long delayNanos);
    void onResult(long attempt, boolean satisfied);
    void onIgnoredError(long attempt, Throwable error);
    /** {@code error} is null on success, the timeout or the propagated action failure otherwise. */
    void onPollEnd(boolean success, long attempts, long elapsedNanos, Throwable error);
  }
}
