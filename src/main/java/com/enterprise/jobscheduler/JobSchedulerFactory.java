package com.enterprise.jobscheduler;

import com.enterprise.jobscheduler.api.JobApi;
import com.enterprise.jobscheduler.config.ConfigValidator;
import com.enterprise.jobscheduler.config.SchedulerConfig;
import com.enterprise.jobscheduler.dispatch.Dispatcher;
import com.enterprise.jobscheduler.dispatch.JobExecutor;
import com.enterprise.jobscheduler.ledger.InvocationLedger;
import com.enterprise.jobscheduler.ledger.MapDBInvocationLedger;
import com.enterprise.jobscheduler.logic.ActionRouter;
import com.enterprise.jobscheduler.logic.JobLogic;
import com.enterprise.jobscheduler.monitoring.HealthChecker;
import com.enterprise.jobscheduler.monitoring.MetricsCollector;
import com.enterprise.jobscheduler.service.JobService;
import com.enterprise.jobscheduler.store.JobStore;
import com.enterprise.jobscheduler.store.MapDBJobStore;
import com.enterprise.jobscheduler.timer.PersistentRuleEngine;
import com.enterprise.jobscheduler.timer.RuleEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating and wiring the job scheduler
 */
public class JobSchedulerFactory {

    private static final Logger logger = LoggerFactory.getLogger(JobSchedulerFactory.class);

    private JobSchedulerFactory() {
    }

    /**
     * Create a job scheduler with default configuration
     */
    public static JobScheduler createDefault() {
        return create(SchedulerConfig.builder().build());
    }

    /**
     * Create a job scheduler with custom configuration, the system UTC clock and the built-in actions
     */
    public static JobScheduler create(SchedulerConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static JobScheduler create(SchedulerConfig config, Clock clock) {
        return create(config, clock, null);
    }

    /**
     * Create a job scheduler with custom job logic
     *
     * @param jobLogic the execution interface, or null for the built-in action router
     */
    public static JobScheduler create(SchedulerConfig config, Clock clock, JobLogic jobLogic) {
        // Validate configuration
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }

        SchedulerConfig.StorageConfig storage = config.getStorageConfig();
        SchedulerConfig.DispatchConfig dispatch = config.getDispatchConfig();
        logger.info("Creating JobScheduler with data directory: {}", storage.getDataDirectory());

        JobStore jobStore = null;
        RuleEngine ruleEngine = null;
        InvocationLedger ledger = null;
        try {
            jobStore = new MapDBJobStore(storage.getJobsDbPath(), storage.isMmapEnabled(), clock);
            ruleEngine = new PersistentRuleEngine(storage.getRulesDbPath(), storage.isMmapEnabled(), clock,
                                                  config.getTimerConfig().getTickInterval());
            ledger = new MapDBInvocationLedger(storage.getInvocationsDbPath(), storage.isMmapEnabled());
        } catch (RuntimeException e) {
            logger.error("Failed to open JobScheduler storage", e);
            closeQuietly(jobStore, ruleEngine);
            throw new IllegalStateException("Failed to create JobScheduler", e);
        }

        MetricsCollector metricsCollector = new MetricsCollector(createMeterRegistry(config.getMonitoringConfig()));
        JobExecutor executor = createExecutor(config.getExecutorConfig(), dispatch);
        JobLogic logic = jobLogic != null
            ? jobLogic
            : ActionRouter.withBuiltInHandlers(clock, dispatch.getSimulatedWorkDelay(), dispatch.getReportBaseUrl());

        Dispatcher dispatcher = new Dispatcher(jobStore, ledger, ruleEngine, logic, executor,
                                               metricsCollector, clock, dispatch.isAsyncDispatch());
        JobService jobService = new JobService(jobStore, ruleEngine, ledger, dispatcher, metricsCollector, clock,
                                               dispatch.getDefaultListLimit(), dispatch.getDefaultInvocationLimit());
        JobApi jobApi = new JobApi(jobService);

        HealthChecker healthChecker = config.getMonitoringConfig().isEnableHealthChecks()
            ? new HealthChecker(ruleEngine, jobStore, ledger, executor,
                                config.getTimerConfig().isWakeLoopEnabled(), clock)
            : null;

        metricsCollector.updateStoredJobs(jobStore.size());
        metricsCollector.updateRegisteredRules(ruleEngine.listRules().size());

        logger.info("JobScheduler created successfully");
        return new JobScheduler(config, jobStore, ruleEngine, ledger, executor, dispatcher,
                                jobService, jobApi, metricsCollector, healthChecker);
    }

    private static MeterRegistry createMeterRegistry(SchedulerConfig.MonitoringConfig config) {
        // An empty composite registry records nothing
        return config.isEnableMetrics() ? new SimpleMeterRegistry() : new CompositeMeterRegistry();
    }

    private static JobExecutor createExecutor(SchedulerConfig.ExecutorConfig config,
                                              SchedulerConfig.DispatchConfig dispatch) {
        return new JobExecutor(
            config.getCorePoolSize(),
            config.getMaximumPoolSize(),
            config.getKeepAliveTime().toMillis(),
            TimeUnit.MILLISECONDS,
            config.getQueueCapacity(),
            dispatch.getExecutionTimeout(),
            config.getShutdownTimeout()
        );
    }

    private static void closeQuietly(JobStore jobStore, RuleEngine ruleEngine) {
        try {
            if (jobStore != null) {
                jobStore.close();
            }
            if (ruleEngine != null) {
                ruleEngine.close();
            }
        } catch (RuntimeException e) {
            logger.warn("Error closing partially opened storage", e);
        }
    }
}
