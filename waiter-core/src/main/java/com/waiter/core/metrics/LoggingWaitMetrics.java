package com.waiter.core.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Out-of-the-box metrics sink writing poll lifecycle events through SLF4J. */
public final class LoggingWaitMetrics implements WaitMetrics {
  private final Logger log;

  public LoggingWaitMetrics() { this(LoggerFactory.getLogger("Waiter")); }
  public LoggingWaitMetrics(Logger log) { this.log = log; }

  @Override public RunScope onPollStart(String waiterName, String runId) {
    log.info("poll.start name={} runId={}", waiterName, runId);
    return new RunScope() {
      @Override public void onAttempt(long attempt, long delayNanos) {
        if (log.isDebugEnabled()) {
          log.debug("attempt.start runId={} attempt={} delayMs={}", runId, attempt, String.format("%.3f", delayNanos / 1_000_000.0));
        }
      }
      @Override public void onResult(long attempt, boolean satisfied) {
        log.debug("attempt.end runId={} attempt={} satisfied={}", runId, attempt, satisfied);
      }
      @Override public void onIgnoredError(long attempt, Throwable error) {
        log.debug("attempt.ignored runId={} attempt={} error={}", runId, attempt, error.toString());
      }
      @Override public void onPollEnd(boolean success, long attempts, long elapsedNanos, Throwable error) {
        String durMs = String.format("%.3f", elapsedNanos / 1_000_000.0);
        if (error == null) {
          log.info("poll.end name={} runId={} attempts={} durMs={} success={}", waiterName, runId, attempts, durMs, success);
        } else {
          log.warn("poll.end name={} runId={} attempts={} durMs={} success={} error={}",
              waiterName, runId, attempts, durMs, success, error.toString());
        }
      }
    };
  }
}
