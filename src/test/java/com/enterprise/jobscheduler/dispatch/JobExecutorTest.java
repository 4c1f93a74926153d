package com.enterprise.jobscheduler.dispatch;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobType;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobExecutorTest {

    private JobExecutor executor;
    private Job job;

    @BeforeEach
    void setUp() {
        executor = new JobExecutor(2, 4, 60, TimeUnit.SECONDS, 10,
                                   Duration.ofMillis(500), Duration.ofSeconds(5));
        job = Job.builder().name("test-job").type(JobType.IMMEDIATE).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (executor.isRunning()) {
            executor.shutdown().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void testSuccessfulExecution() {
        ExecutionOutcome outcome = executor.execute(job, Map.of("value", 21),
            (j, input) -> Map.of("doubled", (Integer) input.get("value") * 2));

        assertTrue(outcome.isSuccess());
        assertEquals(42, outcome.getOutput().get("doubled"));
        assertNull(outcome.getErrorKind());
        assertNull(outcome.getException());
        assertEquals(1, executor.getStatistics().getTotalCompleted());
    }

    @Test
    void testNullOutputBecomesEmpty() {
        ExecutionOutcome outcome = executor.execute(job, Map.of(), (j, input) -> null);

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.getOutput().isEmpty());
    }

    @Test
    void testFailedExecution() {
        ExecutionOutcome outcome = executor.execute(job, Map.of(), (j, input) -> {
            throw new JobExecutionException("Intentional failure");
        });

        assertFalse(outcome.isSuccess());
        assertEquals("Intentional failure", outcome.getErrorMessage());
        assertEquals(ErrorKind.EXECUTION, outcome.getErrorKind());
        assertTrue(outcome.getException() instanceof JobExecutionException);
        assertEquals(1, executor.getStatistics().getTotalFailed());
    }

    @Test
    void testRuntimeExceptionWithoutMessage() {
        ExecutionOutcome outcome = executor.execute(job, Map.of(), (j, input) -> {
            throw new NullPointerException();
        });

        assertFalse(outcome.isSuccess());
        assertEquals(NullPointerException.class.getName(), outcome.getErrorMessage());
    }

    @Test
    void testExecutionTimeout() {
        ExecutionOutcome outcome = executor.execute(job, Map.of(), (j, input) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobExecutionException("interrupted", e);
            }
            return Map.of();
        });

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.TIMEOUT, outcome.getErrorKind());
        assertEquals("Job execution timed out after 500ms", outcome.getErrorMessage());
        assertEquals(1, executor.getStatistics().getTotalTimedOut());
    }

    @Test
    void testSubmitRunsOnDispatchPool() throws Exception {
        CompletableFuture<String> future = executor.submit(() -> Thread.currentThread().getName());

        assertTrue(future.get(5, TimeUnit.SECONDS).startsWith("job-dispatch-"));
    }

    @Test
    void testShutdown() throws Exception {
        assertTrue(executor.isRunning());

        executor.shutdown().get(10, TimeUnit.SECONDS);

        assertFalse(executor.isRunning());
        ExecutionOutcome outcome = executor.execute(job, Map.of(), (j, input) -> Map.of());
        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.DISPATCH, outcome.getErrorKind());
        assertThrows(RejectedExecutionException.class, () -> executor.submit(() -> "late"));
    }
}
