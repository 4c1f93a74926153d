package com.enterprise.jobscheduler.dispatch;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.JobType;
import com.enterprise.jobscheduler.exception.DispatchException;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import com.enterprise.jobscheduler.exception.StoreException;
import com.enterprise.jobscheduler.ledger.InvocationLedger;
import com.enterprise.jobscheduler.ledger.MapDBInvocationLedger;
import com.enterprise.jobscheduler.logic.JobLogic;
import com.enterprise.jobscheduler.monitoring.MetricsCollector;
import com.enterprise.jobscheduler.store.MapDBJobStore;
import com.enterprise.jobscheduler.support.MutableClock;
import com.enterprise.jobscheduler.timer.PersistentRuleEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MapDBJobStore jobStore;
    private PersistentRuleEngine ruleEngine;
    private FailingLedger ledger;
    private JobExecutor executor;
    private MetricsCollector metrics;
    private SwitchableLogic logic;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-15T10:00:00Z");
        jobStore = new MapDBJobStore(tempDir.resolve("jobs.db").toString(), false, clock);
        ruleEngine = new PersistentRuleEngine(tempDir.resolve("rules.db").toString(), false, clock, Duration.ofSeconds(1));
        ledger = new FailingLedger(new MapDBInvocationLedger(tempDir.resolve("invocations.db").toString(), false));
        executor = new JobExecutor(2, 4, 60, TimeUnit.SECONDS, 10, Duration.ofSeconds(5), Duration.ofSeconds(5));
        metrics = new MetricsCollector(new SimpleMeterRegistry());
        logic = new SwitchableLogic();

        dispatcher = new Dispatcher(jobStore, ledger, ruleEngine, logic, executor, metrics, clock, false);
        ruleEngine.setFireListener(dispatcher);
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdown().get(10, TimeUnit.SECONDS);
        ruleEngine.close();
        ledger.close();
        jobStore.close();
    }

    private Job storeJob(JobType type) {
        Instant now = clock.instant();
        return jobStore.createJob(Job.builder()
            .name(type.value() + "-job")
            .type(type)
            .executeAt(now.plusSeconds(60))
            .scheduleExpression("rate(15 minutes)")
            .payload(Map.of("action", "default"))
            .createdAt(now)
            .updatedAt(now)
            .build());
    }

    private Job scheduled(JobType type) throws Exception {
        Job job = storeJob(type);
        String ruleId = type == JobType.ONCE
            ? ruleEngine.registerOneShot(job.getId(), job.getExecuteAt(), job.getPayload())
            : ruleEngine.registerRecurring(job.getId(), job.getScheduleExpression(), job.getPayload());
        return jobStore.attachRule(job.getId(), ruleId);
    }

    @Test
    void testImmediateJobCompletes() throws Exception {
        Job job = storeJob(JobType.IMMEDIATE);
        assertEquals(JobStatus.EXECUTING, job.getStatus());

        Invocation invocation = dispatcher.dispatch(job.getId(), null).orElseThrow();

        assertEquals(InvocationStatus.COMPLETED, invocation.getStatus());
        assertEquals("default", invocation.getInput().get("action"));
        assertEquals(job.getId().toString(), invocation.getOutput().get("jobId"));

        Job updated = jobStore.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, updated.getStatus());
        assertEquals(1, updated.getInvocationCount());
        assertEquals(invocation.getCompletedAt(), updated.getLastExecutedAt());
        assertEquals(invocation, ledger.getInvocation(invocation.getId()).orElseThrow());
    }

    @Test
    void testImmediateJobFails() throws Exception {
        Job job = storeJob(JobType.IMMEDIATE);
        logic.fail = true;

        Invocation invocation = dispatcher.dispatch(job.getId(), Map.of("custom", "input")).orElseThrow();

        assertEquals(InvocationStatus.FAILED, invocation.getStatus());
        assertEquals("logic failed", invocation.getError());
        assertEquals(ErrorKind.EXECUTION, invocation.getErrorKind());
        assertNotNull(invocation.getErrorStack());
        assertEquals("input", invocation.getInput().get("custom"));

        Job updated = jobStore.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, updated.getStatus());
        assertEquals(1, updated.getInvocationCount());
    }

    @Test
    void testOnceJobRemovesRuleOnSuccess() throws Exception {
        Job job = scheduled(JobType.ONCE);

        dispatcher.dispatch(job.getId(), null);

        assertEquals(JobStatus.COMPLETED, jobStore.getJob(job.getId()).orElseThrow().getStatus());
        assertFalse(ruleEngine.getRule(job.getRuleId()).isPresent());
    }

    @Test
    void testOnceJobRemovesRuleOnFailure() throws Exception {
        Job job = scheduled(JobType.ONCE);
        logic.fail = true;

        dispatcher.dispatch(job.getId(), null);

        assertEquals(JobStatus.FAILED, jobStore.getJob(job.getId()).orElseThrow().getStatus());
        assertFalse(ruleEngine.getRule(job.getRuleId()).isPresent());
    }

    @Test
    void testCronJobReturnsToScheduled() throws Exception {
        Job job = scheduled(JobType.CRON);

        dispatcher.dispatch(job.getId(), null);
        logic.fail = true;
        dispatcher.dispatch(job.getId(), null);

        Job updated = jobStore.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.SCHEDULED, updated.getStatus());
        assertEquals(2, updated.getInvocationCount());
        assertTrue(ruleEngine.getRule(job.getRuleId()).isPresent());
    }

    @Test
    void testTimerFireDispatchesJob() throws Exception {
        Job job = scheduled(JobType.ONCE);

        clock.advance(Duration.ofSeconds(60));
        ruleEngine.fireDueRules();

        Job updated = jobStore.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, updated.getStatus());
        assertEquals(1, ledger.queryByJob(job.getId(), null, 10, true).size());
        assertEquals(1.0, ((Number) metrics.getMetrics().get("rules.fired")).doubleValue());
    }

    @Test
    void testDeletedJobIsSkipped() throws Exception {
        Job job = storeJob(JobType.CRON);
        jobStore.deleteJob(job.getId());

        Optional<Invocation> result = dispatcher.dispatch(job.getId(), null);

        assertFalse(result.isPresent());
        assertEquals(0, ledger.size());
    }

    @Test
    void testDuplicateFiresEachRecordInvocation() throws Exception {
        Job job = storeJob(JobType.IMMEDIATE);

        dispatcher.dispatch(job.getId(), null);
        dispatcher.dispatch(job.getId(), null);

        assertEquals(2, ledger.queryByJob(job.getId(), null, 10, true).size());
        assertEquals(2, jobStore.getJob(job.getId()).orElseThrow().getInvocationCount());
    }

    @Test
    void testBookkeepingFailureRecordsDispatchFailure() {
        Job job = storeJob(JobType.IMMEDIATE);
        ledger.failNextUpdate.set(true);

        DispatchException e = assertThrows(DispatchException.class, () -> dispatcher.dispatch(job.getId(), null));
        assertEquals(job.getId(), e.getJobId());

        List<Invocation> invocations = ledger.queryByJob(job.getId(), null, 10, true);
        assertEquals(1, invocations.size());
        assertEquals(InvocationStatus.FAILED, invocations.get(0).getStatus());
        assertEquals(ErrorKind.DISPATCH, invocations.get(0).getErrorKind());
        assertEquals(0.0, ((Number) metrics.getMetrics().get("invocations.running")).doubleValue());
        assertEquals(1.0, ((Number) metrics.getMetrics().get("dispatch.errors")).doubleValue());
    }

    @Test
    void testSubmitDispatchesAsynchronously() throws Exception {
        Job job = storeJob(JobType.IMMEDIATE);

        Optional<Invocation> result = dispatcher.submit(job.getId(), null).get(10, TimeUnit.SECONDS);

        assertTrue(result.isPresent());
        assertEquals(JobStatus.COMPLETED, jobStore.getJob(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void testRejectedFireRecordsFailureAndEndsOnceJob() throws Exception {
        Job job = scheduled(JobType.ONCE);
        JobExecutor saturated = new JobExecutor(1, 1, 60, TimeUnit.SECONDS, 1, Duration.ofSeconds(5), Duration.ofSeconds(5));
        CountDownLatch release = new CountDownLatch(1);
        try {
            // One dispatch thread busy and one queued slot taken
            saturated.submit(() -> {
                release.await();
                return null;
            });
            saturated.submit(() -> {
                release.await();
                return null;
            });
            ruleEngine.setFireListener(
                new Dispatcher(jobStore, ledger, ruleEngine, logic, saturated, metrics, clock, true));

            clock.advance(Duration.ofSeconds(60));
            assertEquals(1, ruleEngine.fireDueRules().size());

            List<Invocation> invocations = ledger.queryByJob(job.getId(), null, 10, true);
            assertEquals(1, invocations.size());
            assertEquals(InvocationStatus.FAILED, invocations.get(0).getStatus());
            assertEquals(ErrorKind.DISPATCH, invocations.get(0).getErrorKind());

            Job updated = jobStore.getJob(job.getId()).orElseThrow();
            assertEquals(JobStatus.FAILED, updated.getStatus());
            assertEquals(1, updated.getInvocationCount());
            assertFalse(ruleEngine.getRule(job.getRuleId()).isPresent());
            assertEquals(1.0, ((Number) metrics.getMetrics().get("dispatch.errors")).doubleValue());
        } finally {
            release.countDown();
            saturated.shutdown().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void testRejectedSubmitFailsFuture() throws Exception {
        Job job = storeJob(JobType.IMMEDIATE);
        JobExecutor stopped = new JobExecutor(1, 1, 60, TimeUnit.SECONDS, 1, Duration.ofSeconds(5), Duration.ofSeconds(5));
        stopped.shutdown().get(10, TimeUnit.SECONDS);
        Dispatcher rejecting = new Dispatcher(jobStore, ledger, ruleEngine, logic, stopped, metrics, clock, true);

        CompletableFuture<Optional<Invocation>> future = rejecting.submit(job.getId(), null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(DispatchException.class, e.getCause());
        assertEquals(JobStatus.FAILED, jobStore.getJob(job.getId()).orElseThrow().getStatus());
        assertEquals(1, ledger.queryByJob(job.getId(), InvocationStatus.FAILED, 10, true).size());
    }

    @Test
    void testNextStatus() {
        assertEquals(JobStatus.COMPLETED, Dispatcher.nextStatus(JobType.IMMEDIATE, true));
        assertEquals(JobStatus.FAILED, Dispatcher.nextStatus(JobType.ONCE, false));
        assertEquals(JobStatus.SCHEDULED, Dispatcher.nextStatus(JobType.CRON, true));
        assertEquals(JobStatus.SCHEDULED, Dispatcher.nextStatus(JobType.CRON, false));
    }

    /**
     * Echoes the job ID, or fails when told to
     */
    private static class SwitchableLogic implements JobLogic {
        volatile boolean fail;

        @Override
        public Map<String, Object> execute(Job job, Map<String, Object> input) throws JobExecutionException {
            if (fail) {
                throw new JobExecutionException("logic failed");
            }
            return Map.of("jobId", job.getId().toString());
        }
    }

    /**
     * Ledger that can fail its next update once
     */
    private static class FailingLedger implements InvocationLedger {
        private final InvocationLedger delegate;
        final AtomicBoolean failNextUpdate = new AtomicBoolean(false);

        FailingLedger(InvocationLedger delegate) {
            this.delegate = delegate;
        }

        @Override
        public Invocation recordInvocation(Invocation invocation) {
            return delegate.recordInvocation(invocation);
        }

        @Override
        public void updateInvocation(Invocation invocation) {
            if (failNextUpdate.compareAndSet(true, false)) {
                throw new StoreException("Simulated store outage", new IllegalStateException("disk full"));
            }
            delegate.updateInvocation(invocation);
        }

        @Override
        public Optional<Invocation> getInvocation(UUID invocationId) {
            return delegate.getInvocation(invocationId);
        }

        @Override
        public List<Invocation> queryByJob(UUID jobId, InvocationStatus statusFilter, int limit, boolean newestFirst) {
            return delegate.queryByJob(jobId, statusFilter, limit, newestFirst);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
