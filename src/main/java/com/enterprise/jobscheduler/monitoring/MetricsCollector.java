package com.enterprise.jobscheduler.monitoring;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.JobType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the job scheduler
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> jobTypeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<JobType, Timer> jobTypeTimers = new ConcurrentHashMap<>();

    // Core metrics
    private final Counter jobsCreated;
    private final Counter jobsDeleted;
    private final Counter rulesFired;
    private final Counter invocationsCompleted;
    private final Counter invocationsFailed;
    private final Counter invocationsTimedOut;
    private final Counter dispatchErrors;

    private final Timer executionTime;

    // Gauges
    private final AtomicLong storedJobs = new AtomicLong(0);
    private final AtomicLong registeredRules = new AtomicLong(0);
    private final AtomicLong runningInvocations = new AtomicLong(0);

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.jobsCreated = Counter.builder("jobscheduler.jobs.created")
            .description("Total number of jobs created")
            .register(meterRegistry);

        this.jobsDeleted = Counter.builder("jobscheduler.jobs.deleted")
            .description("Total number of jobs deleted")
            .register(meterRegistry);

        this.rulesFired = Counter.builder("jobscheduler.rules.fired")
            .description("Total number of timer rule fires")
            .register(meterRegistry);

        this.invocationsCompleted = Counter.builder("jobscheduler.invocations.completed")
            .description("Total number of invocations completed successfully")
            .register(meterRegistry);

        this.invocationsFailed = Counter.builder("jobscheduler.invocations.failed")
            .description("Total number of invocations that failed")
            .register(meterRegistry);

        this.invocationsTimedOut = Counter.builder("jobscheduler.invocations.timedout")
            .description("Total number of invocations that timed out")
            .register(meterRegistry);

        this.dispatchErrors = Counter.builder("jobscheduler.dispatch.errors")
            .description("Total number of unexpected dispatch failures")
            .register(meterRegistry);

        this.executionTime = Timer.builder("jobscheduler.invocation.execution.time")
            .description("Invocation execution time")
            .register(meterRegistry);

        Gauge.builder("jobscheduler.jobs.stored", storedJobs, AtomicLong::get)
            .description("Number of stored jobs")
            .register(meterRegistry);

        Gauge.builder("jobscheduler.rules.registered", registeredRules, AtomicLong::get)
            .description("Number of registered timer rules")
            .register(meterRegistry);

        Gauge.builder("jobscheduler.invocations.running", runningInvocations, AtomicLong::get)
            .description("Number of invocations currently running")
            .register(meterRegistry);

        logger.info("MetricsCollector initialized");
    }

    public void recordJobCreated(JobType type) {
        jobsCreated.increment();
        getJobTypeCounter(type, "created").increment();
    }

    public void recordJobDeleted(JobType type) {
        jobsDeleted.increment();
        getJobTypeCounter(type, "deleted").increment();
    }

    public void recordRuleFired(String ruleId) {
        rulesFired.increment();
        logger.debug("Recorded fire of rule {}", ruleId);
    }

    public void recordInvocationStarted() {
        runningInvocations.incrementAndGet();
    }

    /**
     * Record a successful invocation
     */
    public void recordInvocationCompleted(JobType type, long durationMs) {
        runningInvocations.decrementAndGet();
        invocationsCompleted.increment();
        getJobTypeCounter(type, "completed").increment();

        executionTime.record(durationMs, TimeUnit.MILLISECONDS);
        getJobTypeTimer(type).record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a failed invocation; timeouts are also counted separately
     */
    public void recordInvocationFailed(JobType type, ErrorKind kind, long durationMs) {
        runningInvocations.decrementAndGet();
        invocationsFailed.increment();
        getJobTypeCounter(type, "failed").increment();

        executionTime.record(durationMs, TimeUnit.MILLISECONDS);
        getJobTypeTimer(type).record(durationMs, TimeUnit.MILLISECONDS);

        if (kind == ErrorKind.TIMEOUT) {
            invocationsTimedOut.increment();
            getJobTypeCounter(type, "timedout").increment();
        }
    }

    /**
     * Record a running invocation closed by a dispatch failure
     */
    public void recordInvocationAborted() {
        runningInvocations.decrementAndGet();
        invocationsFailed.increment();
    }

    public void recordDispatchError(UUID jobId) {
        dispatchErrors.increment();
        logger.debug("Recorded dispatch error for job {}", jobId);
    }

    public void updateStoredJobs(int count) {
        storedJobs.set(count);
    }

    public void updateRegisteredRules(int count) {
        registeredRules.set(count);
    }

    private Counter getJobTypeCounter(JobType type, String status) {
        String key = type.value() + "." + status;
        return jobTypeCounters.computeIfAbsent(key, k ->
            Counter.builder("jobscheduler.job.type")
                .tag("type", type.value())
                .tag("status", status)
                .description("Job events by type and status")
                .register(meterRegistry)
        );
    }

    private Timer getJobTypeTimer(JobType type) {
        return jobTypeTimers.computeIfAbsent(type, k ->
            Timer.builder("jobscheduler.job.type.execution.time")
                .tag("type", type.value())
                .description("Invocation execution time by job type")
                .register(meterRegistry)
        );
    }

    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("jobs.created", jobsCreated.count());
        metrics.put("jobs.deleted", jobsDeleted.count());
        metrics.put("rules.fired", rulesFired.count());
        metrics.put("invocations.completed", invocationsCompleted.count());
        metrics.put("invocations.failed", invocationsFailed.count());
        metrics.put("invocations.timedout", invocationsTimedOut.count());
        metrics.put("dispatch.errors", dispatchErrors.count());

        metrics.put("invocation.execution.time.mean", executionTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("invocation.execution.time.max", executionTime.max(TimeUnit.MILLISECONDS));

        metrics.put("jobs.stored", storedJobs.get());
        metrics.put("rules.registered", registeredRules.get());
        metrics.put("invocations.running", runningInvocations.get());

        return metrics;
    }
}
