package com.enterprise.jobscheduler.monitoring;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.JobType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricsCollector(registry);
    }

    private static double value(Map<String, Object> snapshot, String key) {
        return ((Number) snapshot.get(key)).doubleValue();
    }

    @Test
    void testInvocationCounters() {
        metrics.recordInvocationStarted();
        metrics.recordInvocationStarted();
        metrics.recordInvocationStarted();
        metrics.recordInvocationCompleted(JobType.CRON, 120);
        metrics.recordInvocationFailed(JobType.ONCE, ErrorKind.TIMEOUT, 5000);

        Map<String, Object> snapshot = metrics.getMetrics();
        assertEquals(1.0, value(snapshot, "invocations.completed"));
        assertEquals(1.0, value(snapshot, "invocations.failed"));
        assertEquals(1.0, value(snapshot, "invocations.timedout"));
        assertEquals(1.0, value(snapshot, "invocations.running"));
        assertEquals(5000.0, value(snapshot, "invocation.execution.time.max"));

        assertEquals(1.0, registry.get("jobscheduler.job.type")
            .tags("type", "cron", "status", "completed").counter().count());
    }

    @Test
    void testAbortedInvocationLeavesNothingRunning() {
        metrics.recordInvocationStarted();
        metrics.recordInvocationAborted();
        metrics.recordDispatchError(UUID.randomUUID());

        Map<String, Object> snapshot = metrics.getMetrics();
        assertEquals(0.0, value(snapshot, "invocations.running"));
        assertEquals(1.0, value(snapshot, "invocations.failed"));
        assertEquals(1.0, value(snapshot, "dispatch.errors"));
    }

    @Test
    void testJobAndRuleGauges() {
        metrics.recordJobCreated(JobType.IMMEDIATE);
        metrics.recordJobCreated(JobType.CRON);
        metrics.recordJobDeleted(JobType.CRON);
        metrics.recordRuleFired("job-1");
        metrics.updateStoredJobs(7);
        metrics.updateRegisteredRules(3);

        Map<String, Object> snapshot = metrics.getMetrics();
        assertEquals(2.0, value(snapshot, "jobs.created"));
        assertEquals(1.0, value(snapshot, "jobs.deleted"));
        assertEquals(1.0, value(snapshot, "rules.fired"));
        assertEquals(7.0, value(snapshot, "jobs.stored"));
        assertEquals(3.0, registry.get("jobscheduler.rules.registered").gauge().value());
    }
}
