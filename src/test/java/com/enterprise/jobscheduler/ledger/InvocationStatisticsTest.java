package com.enterprise.jobscheduler.ledger;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.Invocation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InvocationStatisticsTest {

    private static final UUID JOB_ID = UUID.randomUUID();
    private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

    private static Invocation completed(long durationMs) {
        return Invocation.running(JOB_ID, START, null).complete(Map.of(), START.plusMillis(durationMs));
    }

    private static Invocation failed(long durationMs) {
        return Invocation.running(JOB_ID, START, null)
            .fail("boom", null, ErrorKind.EXECUTION, START.plusMillis(durationMs));
    }

    @Test
    void testEmptyWindow() {
        InvocationStatistics stats = InvocationStatistics.of(List.of());

        assertEquals(0, stats.getTotal());
        assertEquals(0, stats.getAverageDurationMs());
        assertEquals(0.0, stats.getSuccessRatePercent());
    }

    @Test
    void testSuccessRateRoundsToTwoDecimals() {
        InvocationStatistics stats = InvocationStatistics.of(List.of(completed(100), completed(200), failed(50)));

        assertEquals(3, stats.getTotal());
        assertEquals(2, stats.getCompleted());
        assertEquals(1, stats.getFailed());
        assertEquals(66.67, stats.getSuccessRatePercent(), 0.0001);
    }

    @Test
    void testAverageCoversCompletedOnly() {
        // (100 + 101) / 2 = 100.5 rounds up; the failed run's duration is ignored
        InvocationStatistics stats = InvocationStatistics.of(List.of(completed(100), completed(101), failed(10_000)));

        assertEquals(101, stats.getAverageDurationMs());
    }

    @Test
    void testRunningCountsTowardTotal() {
        Invocation running = Invocation.running(JOB_ID, START, null);

        InvocationStatistics stats = InvocationStatistics.of(List.of(running, completed(40)));

        assertEquals(2, stats.getTotal());
        assertEquals(1, stats.getRunning());
        assertEquals(50.0, stats.getSuccessRatePercent());
        assertEquals(40, stats.getAverageDurationMs());
    }

    @Test
    void testNoCompletedInvocations() {
        InvocationStatistics stats = InvocationStatistics.of(List.of(failed(10), failed(20)));

        assertEquals(0, stats.getAverageDurationMs());
        assertEquals(0.0, stats.getSuccessRatePercent());
        assertEquals(2, stats.getFailed());
    }
}
