package com.waiter.core.metrics;

import com.waiter.core.WaitTimeoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Records poll runs into a Micrometer registry under {@code waiter.<name>.*}:
 * counters {@code attempts}, {@code ignored_errors}, {@code successes}, {@code timeouts}, {@code aborts}
 * and the timer {@code duration}.
 */
public final class MicrometerWaitMetrics implements WaitMetrics {
  private final MeterRegistry registry;

  public MicrometerWaitMetrics() { this(new SimpleMeterRegistry()); }
  public MicrometerWaitMetrics(MeterRegistry registry) { this.registry = Objects.requireNonNull(registry, "registry"); }

  public MeterRegistry registry() { return registry; }

  @Override public RunScope onPollStart(String waiterName, String runId) {
    Counter attempts = counter(waiterName, "attempts");
    Counter ignored = counter(waiterName, "ignored_errors");
    return new RunScope() {
      @Override public void onAttempt(long attempt, long delayNanos) { attempts.increment(); }
      @Override public void onResult(long attempt, boolean satisfied) {}
      @Override public void onIgnoredError(long attempt, Throwable error) { ignored.increment(); }
      @Override public void onPollEnd(boolean success, long count, long elapsedNanos, Throwable error) {
        Timer.builder(metric(waiterName, "duration")).register(registry).record(elapsedNanos, TimeUnit.NANOSECONDS);
        String outcome;
        if (success) outcome = "successes";
        else if (error instanceof WaitTimeoutException) outcome = "timeouts";
        else outcome = "aborts";
        counter(waiterName, outcome).increment();
      }
    };
  }

  private Counter counter(String waiterName, String name) {
    return Counter.builder(metric(waiterName, name)).register(registry);
  }

  private static String metric(String waiterName, String name) {
    return "waiter." + waiterName + "." + name;
  }
}
