package com.enterprise.jobscheduler;

import com.enterprise.jobscheduler.api.JobApi;
import com.enterprise.jobscheduler.config.SchedulerConfig;
import com.enterprise.jobscheduler.dispatch.Dispatcher;
import com.enterprise.jobscheduler.dispatch.JobExecutor;
import com.enterprise.jobscheduler.ledger.InvocationLedger;
import com.enterprise.jobscheduler.monitoring.HealthChecker;
import com.enterprise.jobscheduler.monitoring.MetricsCollector;
import com.enterprise.jobscheduler.service.JobService;
import com.enterprise.jobscheduler.store.JobStore;
import com.enterprise.jobscheduler.timer.FireSignal;
import com.enterprise.jobscheduler.timer.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A wired job scheduler with a start/stop lifecycle. Created by {@link JobSchedulerFactory}.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final SchedulerConfig config;
    private final JobStore jobStore;
    private final RuleEngine ruleEngine;
    private final InvocationLedger ledger;
    private final JobExecutor executor;
    private final Dispatcher dispatcher;
    private final JobService jobService;
    private final JobApi jobApi;
    private final MetricsCollector metricsCollector;
    private final HealthChecker healthChecker;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledExecutorService healthScheduler;

    JobScheduler(SchedulerConfig config, JobStore jobStore, RuleEngine ruleEngine, InvocationLedger ledger,
                 JobExecutor executor, Dispatcher dispatcher, JobService jobService, JobApi jobApi,
                 MetricsCollector metricsCollector, HealthChecker healthChecker) {
        this.config = config;
        this.jobStore = jobStore;
        this.ruleEngine = ruleEngine;
        this.ledger = ledger;
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.jobService = jobService;
        this.jobApi = jobApi;
        this.metricsCollector = metricsCollector;
        this.healthChecker = healthChecker;

        // Manual ticks dispatch too, with or without the wake loop
        ruleEngine.setFireListener(dispatcher);
    }

    /**
     * Start the wake loop and the periodic health checks
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("JobScheduler is closed");
        }
        if (!running.compareAndSet(false, true)) {
            logger.warn("JobScheduler is already running");
            return;
        }

        if (config.getTimerConfig().isWakeLoopEnabled()) {
            ruleEngine.start();
        }
        startHealthChecks();

        logger.info("JobScheduler started ({} jobs, {} rules)", jobStore.size(), ruleEngine.listRules().size());
    }

    private void startHealthChecks() {
        Duration interval = config.getMonitoringConfig().getHealthCheckInterval();
        if (healthChecker == null || interval.isZero()) {
            return;
        }
        healthScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler-health");
            t.setDaemon(true);
            return t;
        });
        healthScheduler.scheduleWithFixedDelay(() -> {
            try {
                HealthChecker.HealthStatus status = healthChecker.check();
                logger.debug("Health check completed, healthy={}", status.isHealthy());
            } catch (Exception e) {
                logger.error("Error running health check", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the wake loop. Dispatches already submitted keep running; stored jobs and rules are kept.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping JobScheduler...");

        ruleEngine.stop();
        if (healthScheduler != null) {
            healthScheduler.shutdownNow();
            healthScheduler = null;
        }

        logger.info("JobScheduler stopped");
    }

    /**
     * Run one timer tick on the calling thread
     */
    public List<FireSignal> tick() {
        return ruleEngine.fireDueRules();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stop();
        executor.shutdown().join();
        ruleEngine.close();
        ledger.close();
        jobStore.close();
        logger.info("JobScheduler closed");
    }

    public SchedulerConfig getConfig() { return config; }

    public JobStore getJobStore() { return jobStore; }

    public RuleEngine getRuleEngine() { return ruleEngine; }

    public InvocationLedger getLedger() { return ledger; }

    public JobExecutor getExecutor() { return executor; }

    public Dispatcher getDispatcher() { return dispatcher; }

    public JobService getJobService() { return jobService; }

    public JobApi getJobApi() { return jobApi; }

    public MetricsCollector getMetricsCollector() { return metricsCollector; }

    /**
     * Health checker, empty when health checks are disabled
     */
    public Optional<HealthChecker> getHealthChecker() {
        return Optional.ofNullable(healthChecker);
    }
}
