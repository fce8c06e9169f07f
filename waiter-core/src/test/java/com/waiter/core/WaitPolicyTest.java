package com.waiter.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class WaitPolicyTest {

    @Test
    void unlimitedWaiterIsRejected() {
        assertThrows(UnlimitedWaiterException.class, () -> WaitPolicy.builder().build());
    }

    @Test
    void unlimitedCheckWinsOverOtherErrors() {
        assertThrows(UnlimitedWaiterException.class, () -> WaitPolicy.builder()
            .interval(Duration.ofMillis(-1))
            .maxInterval(Duration.ofSeconds(1))
            .build());
    }

    @Test
    void maxIntervalWithoutExponentialIsRejected() {
        assertThrows(UnusedMaxIntervalException.class, () -> WaitPolicy.builder()
            .timeout(Duration.ofMillis(10))
            .maxInterval(Duration.ofMillis(10))
            .build());
    }

    @Test
    void configurationErrorsShareOneParent() {
        WaiterConfigurationException ex = assertThrows(WaiterConfigurationException.class,
            () -> WaitPolicy.builder().build());
        assertInstanceOf(IllegalArgumentException.class, ex);
    }

    @Test
    void negativeValuesAreRejected() {
        assertThrows(WaiterConfigurationException.class,
            () -> WaitPolicy.builder().timeout(Duration.ofSeconds(-1)).build());
        assertThrows(WaiterConfigurationException.class,
            () -> WaitPolicy.builder().timeout(Duration.ofSeconds(1)).maxAttempts(-3).build());
        assertThrows(WaiterConfigurationException.class,
            () -> WaitPolicy.builder().maxAttempts(1).interval(Duration.ofMillis(-5)).build());
        assertThrows(WaiterConfigurationException.class,
            () -> WaitPolicy.builder().maxAttempts(1).exponential(true).maxInterval(Duration.ofMillis(-5)).build());
    }

    @Test
    void eitherLimitIsEnough() {
        assertTrue(WaitPolicy.builder().maxAttempts(1).build().hasMaxAttempts());
        WaitPolicy p = WaitPolicy.builder().timeout(Duration.ofMillis(1)).build();
        assertTrue(p.hasTimeout());
        assertFalse(p.hasMaxAttempts());
        assertEquals(WaitPolicy.DEFAULT_INTERVAL, p.interval());
    }

    @Test
    void fixedDelayIgnoresAttemptCount() {
        WaitPolicy p = WaitPolicy.builder().maxAttempts(1).interval(Duration.ofMillis(7)).build();
        assertEquals(TimeUnit.MILLISECONDS.toNanos(7), p.delayNanos(0));
        assertEquals(TimeUnit.MILLISECONDS.toNanos(7), p.delayNanos(30));
    }

    @Test
    void exponentialDelayDoublesAndCaps() {
        WaitPolicy uncapped = WaitPolicy.builder().maxAttempts(1).interval(Duration.ofMillis(1)).exponential(true).build();
        assertEquals(TimeUnit.MILLISECONDS.toNanos(1), uncapped.delayNanos(0));
        assertEquals(TimeUnit.MILLISECONDS.toNanos(8), uncapped.delayNanos(3));

        WaitPolicy capped = uncapped.toBuilder().maxInterval(Duration.ofMillis(5)).build();
        assertEquals(TimeUnit.MILLISECONDS.toNanos(4), capped.delayNanos(2));
        assertEquals(TimeUnit.MILLISECONDS.toNanos(5), capped.delayNanos(3));
        assertEquals(TimeUnit.MILLISECONDS.toNanos(5), capped.delayNanos(1_000));
    }

    @Test
    void exponentialDelaySaturatesInsteadOfOverflowing() {
        WaitPolicy p = WaitPolicy.builder().maxAttempts(1).interval(Duration.ofSeconds(1)).exponential(true).build();
        assertEquals(Long.MAX_VALUE, p.delayNanos(40));
        assertEquals(Long.MAX_VALUE, p.delayNanos(200));
        assertTrue(p.delayNanos(20) > 0);
    }

    @Test
    void zeroIntervalStaysZeroWhenExponential() {
        WaitPolicy p = WaitPolicy.builder().maxAttempts(1).interval(Duration.ZERO).exponential(true).build();
        assertEquals(0L, p.delayNanos(10));
    }

    @Test
    void ignoreMatcherDefaultsToNothing() {
        WaitPolicy p = WaitPolicy.builder().maxAttempts(1).ignore(null).build();
        assertFalse(p.ignore().matches(new RuntimeException()));
    }

    @Test
    void ignoringBuildsATypeMatcher() {
        WaitPolicy p = WaitPolicy.builder().maxAttempts(1).ignoring(IOException.class).build();
        assertTrue(p.ignore().matches(new IOException()));
        assertFalse(p.ignore().matches(new UncheckedIOException(new IOException())));
        assertEquals(p, p.toBuilder().build());
    }

    @Test
    void hugeTimeoutDoesNotOverflow() {
        WaitPolicy p = WaitPolicy.builder().timeout(Duration.ofSeconds(Long.MAX_VALUE)).build();
        assertEquals(Long.MAX_VALUE, p.timeoutNanos());
    }

    @Test
    void delayHandlesAttemptCountsBeyondIntRange() {
        long beyondInt = Integer.MAX_VALUE + 1L;
        WaitPolicy fixed = WaitPolicy.builder().timeout(Duration.ofSeconds(1)).interval(Duration.ofMillis(3)).build();
        assertEquals(TimeUnit.MILLISECONDS.toNanos(3), fixed.delayNanos(beyondInt));

        WaitPolicy exponential = fixed.toBuilder().exponential(true).build();
        assertEquals(Long.MAX_VALUE, exponential.delayNanos(beyondInt));
        assertEquals(Long.MAX_VALUE, exponential.delayNanos(Long.MAX_VALUE));

        WaitPolicy capped = exponential.toBuilder().maxInterval(Duration.ofMillis(50)).build();
        assertEquals(TimeUnit.MILLISECONDS.toNanos(50), capped.delayNanos(beyondInt));
    }

    @Test
    void negativeAttemptCountIsRejected() {
        WaitPolicy p = WaitPolicy.builder().maxAttempts(1).exponential(true).build();
        assertThrows(IllegalArgumentException.class, () -> p.delayNanos(-1));
    }
}
