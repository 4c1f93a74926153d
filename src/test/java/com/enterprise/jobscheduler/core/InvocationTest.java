package com.enterprise.jobscheduler.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InvocationTest {

    private static final Instant STARTED = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void testCompleteSetsDurationAndOutput() {
        Invocation running = Invocation.running(UUID.randomUUID(), STARTED, Map.of("action", "cleanup"));

        Invocation completed = running.complete(Map.of("recordsDeleted", 3), STARTED.plusMillis(250));

        assertEquals(InvocationStatus.COMPLETED, completed.getStatus());
        assertEquals(250L, completed.getDurationMs());
        assertEquals(3, completed.getOutput().get("recordsDeleted"));
        assertEquals("cleanup", completed.getInput().get("action"));
        assertNull(completed.getError());
        assertTrue(completed.isFinalized());
    }

    @Test
    void testFailRecordsErrorKind() {
        Invocation running = Invocation.running(UUID.randomUUID(), STARTED, null);

        Invocation failed = running.fail("boom", "trace", ErrorKind.TIMEOUT, STARTED.plusSeconds(1));

        assertEquals(InvocationStatus.FAILED, failed.getStatus());
        assertEquals("boom", failed.getError());
        assertEquals(ErrorKind.TIMEOUT, failed.getErrorKind());
        assertNull(failed.getOutput());
        assertTrue(failed.getInput().isEmpty());
    }

    @Test
    void testFinalizedInvocationCannotChange() {
        Invocation completed = Invocation.running(UUID.randomUUID(), STARTED, null)
            .complete(Map.of(), STARTED.plusSeconds(1));

        assertThrows(IllegalStateException.class,
            () -> completed.fail("late", null, ErrorKind.EXECUTION, STARTED.plusSeconds(2)));
        assertThrows(IllegalStateException.class,
            () -> completed.complete(Map.of(), STARTED.plusSeconds(2)));
    }

    @Test
    void testFailedImmediatelyIsDispatchFailure() {
        Invocation failed = Invocation.failedImmediately(UUID.randomUUID(), STARTED, STARTED.plusMillis(5),
                                                         new IllegalStateException("store down"));

        assertEquals(InvocationStatus.FAILED, failed.getStatus());
        assertEquals(ErrorKind.DISPATCH, failed.getErrorKind());
        assertEquals("store down", failed.getError());
        assertTrue(failed.getErrorStack().contains("IllegalStateException"));
        assertEquals(5L, failed.getDurationMs());
    }
}
