package com.waiter.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PollReportTest {
    private static final long PAST_INT_RANGE = 3_000_000_000L;

    @Test
    void reportAcceptsAttemptCountsPastIntRange() {
        var report = new PollReport<>(PollReport.Outcome.TIMED_OUT, PAST_INT_RANGE, List.of(false), 5_000_000L);
        assertEquals(PAST_INT_RANGE, report.callsCount());
        assertFalse(report.succeeded());
        assertEquals(Duration.ofMillis(5), report.elapsed());
    }

    @Test
    void timeoutCarriesAttemptCountsPastIntRange() {
        var ex = new WaitTimeoutException("busy", PAST_INT_RANGE, List.of(), 60_000_000_000L);
        assertEquals(PAST_INT_RANGE, ex.callsCount());
        assertFalse(ex.hasLastResult());
        assertTrue(ex.getMessage().contains("after 3000000000 action calls"), ex.getMessage());
    }

    @Test
    void negativeCountIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new PollReport<>(PollReport.Outcome.ABORTED, -1L, List.of(), 0L));
    }

    @Test
    void resultsAreACopyAndMayHoldNull() {
        List<Object> source = Arrays.asList(null, 1);
        var report = new PollReport<>(PollReport.Outcome.SATISFIED, 2L, source, 0L);
        source.set(1, 2);
        assertEquals(Arrays.asList(null, 1), report.results());
        assertThrows(UnsupportedOperationException.class, () -> report.results().add(3));
    }
}
