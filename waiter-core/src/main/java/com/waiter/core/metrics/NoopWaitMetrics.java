package com.waiter.core.metrics;

public final class NoopWaitMetrics implements WaitMetrics {
  public static final NoopWaitMetrics INSTANCE = new NoopWaitMetrics();
  private static final RunScope NOOP_SCOPE = new RunScope() {
    public void onAttempt(long attempt, long delayNanos) {}
    public void onResult(long attempt, boolean satisfied) {}
    public void onIgnoredError(long attempt, Throwable error) {}
    public void onPollEnd(boolean success, long attempts, long elapsedNanos, Throwable error) {}
  };
  private NoopWaitMetrics() {}
  @Override public RunScope onPollStart(String waiterName, String runId) { return NOOP_SCOPE; }
}
