package com.enterprise.jobscheduler.monitoring;

import com.enterprise.jobscheduler.dispatch.JobExecutor;
import com.enterprise.jobscheduler.ledger.InvocationLedger;
import com.enterprise.jobscheduler.store.JobStore;
import com.enterprise.jobscheduler.timer.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the job scheduler
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private final RuleEngine ruleEngine;
    private final JobStore jobStore;
    private final InvocationLedger ledger;
    private final JobExecutor executor;
    private final boolean wakeLoopExpected;
    private final Clock clock;

    public HealthChecker(RuleEngine ruleEngine, JobStore jobStore, InvocationLedger ledger,
                         JobExecutor executor, boolean wakeLoopExpected, Clock clock) {
        this.ruleEngine = ruleEngine;
        this.jobStore = jobStore;
        this.ledger = ledger;
        this.executor = executor;
        this.wakeLoopExpected = wakeLoopExpected;
        this.clock = clock;
    }

    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(this::check);
    }

    /**
     * Run every check on the calling thread
     */
    public HealthStatus check() {
        HealthStatus.Builder builder = HealthStatus.builder();

        checkTimer(builder);
        checkStores(builder);
        checkExecutor(builder);
        checkSystemResources(builder);

        HealthStatus status = builder.build(clock.instant());
        if (!status.isHealthy()) {
            logger.warn("Health check failed: {}", status.getFailedChecks());
        }
        return status;
    }

    private void checkTimer(HealthStatus.Builder builder) {
        try {
            if (wakeLoopExpected) {
                boolean running = ruleEngine.isRunning();
                builder.addCheck("timer.running", running,
                    running ? "Timer wake loop is running" : "Timer wake loop is not running");
            }
            int rules = ruleEngine.listRules().size();
            builder.addCheck("timer.rules", true, String.format("Registered rules: %d", rules));

        } catch (Exception e) {
            builder.addCheck("timer.status", false, "Error checking timer status: " + e.getMessage());
        }
    }

    private void checkStores(HealthStatus.Builder builder) {
        try {
            builder.addCheck("store.jobs", true, String.format("Stored jobs: %d", jobStore.size()));
        } catch (Exception e) {
            builder.addCheck("store.jobs", false, "Error reading job store: " + e.getMessage());
        }
        try {
            builder.addCheck("store.invocations", true, String.format("Stored invocations: %d", ledger.size()));
        } catch (Exception e) {
            builder.addCheck("store.invocations", false, "Error reading invocation ledger: " + e.getMessage());
        }
    }

    private void checkExecutor(HealthStatus.Builder builder) {
        try {
            boolean running = executor.isRunning();
            builder.addCheck("executor.running", running,
                running ? "Executor is running" : "Executor is shut down");

            JobExecutor.ExecutorStatistics stats = executor.getStatistics();
            int queued = stats.getQueueSize();
            int capacity = queued + stats.getQueueRemainingCapacity();
            boolean queueHealthy = capacity == 0 || (double) queued / capacity < 0.9; // 90% threshold
            builder.addCheck("executor.queue", queueHealthy,
                String.format("Queued dispatches: %d of %d", queued, capacity));

            long executed = stats.getTotalExecuted();
            if (executed > 0) {
                double successRate = (double) stats.getTotalCompleted() / executed * 100;
                builder.addCheck("invocations.success_rate", true,
                    String.format("Invocation success rate: %.2f%% (%d/%d)",
                        successRate, stats.getTotalCompleted(), executed));
            }

        } catch (Exception e) {
            builder.addCheck("executor.status", false, "Error checking executor: " + e.getMessage());
        }
    }

    private void checkSystemResources(HealthStatus.Builder builder) {
        try {
            Runtime runtime = Runtime.getRuntime();
            long maxMemory = runtime.maxMemory();
            long usedMemory = runtime.totalMemory() - runtime.freeMemory();
            double memoryUsagePercent = (double) usedMemory / maxMemory * 100;

            boolean memoryHealthy = memoryUsagePercent < 90; // 90% threshold
            builder.addCheck("system.memory", memoryHealthy,
                String.format("Memory usage: %.2f%% (%d/%d MB)",
                    memoryUsagePercent, usedMemory / 1024 / 1024, maxMemory / 1024 / 1024));

        } catch (Exception e) {
            builder.addCheck("system.resources", false, "Error checking system resources: " + e.getMessage());
        }
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        public Map<String, String> getFailedChecks() {
            Map<String, String> failed = new ConcurrentHashMap<>();
            checks.forEach((name, result) -> {
                if (!result.isPassed()) {
                    failed.put(name, result.getMessage());
                }
            });
            return failed;
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build(Instant timestamp) {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, timestamp);
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
