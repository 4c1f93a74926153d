package com.enterprise.jobscheduler.config;

import java.io.File;
import java.time.Duration;

/**
 * Configuration for the job scheduler
 */
public class SchedulerConfig {

    private final ExecutorConfig executorConfig;
    private final StorageConfig storageConfig;
    private final TimerConfig timerConfig;
    private final DispatchConfig dispatchConfig;
    private final MonitoringConfig monitoringConfig;

    public SchedulerConfig(ExecutorConfig executorConfig, StorageConfig storageConfig,
                           TimerConfig timerConfig, DispatchConfig dispatchConfig,
                           MonitoringConfig monitoringConfig) {
        this.executorConfig = executorConfig;
        this.storageConfig = storageConfig;
        this.timerConfig = timerConfig;
        this.dispatchConfig = dispatchConfig;
        this.monitoringConfig = monitoringConfig;
    }

    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public StorageConfig getStorageConfig() { return storageConfig; }
    public TimerConfig getTimerConfig() { return timerConfig; }
    public DispatchConfig getDispatchConfig() { return dispatchConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }

    /**
     * Executor configuration, applied to both the worker and the dispatch pool
     */
    public static class ExecutorConfig {
        private final int corePoolSize;
        private final int maximumPoolSize;
        private final Duration keepAliveTime;
        private final int queueCapacity;
        private final Duration shutdownTimeout;

        public ExecutorConfig(int corePoolSize, int maximumPoolSize, Duration keepAliveTime,
                              int queueCapacity, Duration shutdownTimeout) {
            this.corePoolSize = corePoolSize;
            this.maximumPoolSize = maximumPoolSize;
            this.keepAliveTime = keepAliveTime;
            this.queueCapacity = queueCapacity;
            this.shutdownTimeout = shutdownTimeout;
        }

        public int getCorePoolSize() { return corePoolSize; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public Duration getKeepAliveTime() { return keepAliveTime; }
        public int getQueueCapacity() { return queueCapacity; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }

    /**
     * Storage configuration. The three databases live side by side in the data directory.
     */
    public static class StorageConfig {
        public static final String JOBS_DB = "jobs.db";
        public static final String RULES_DB = "rules.db";
        public static final String INVOCATIONS_DB = "invocations.db";

        private final String dataDirectory;
        private final boolean mmapEnabled;

        public StorageConfig(String dataDirectory, boolean mmapEnabled) {
            this.dataDirectory = dataDirectory;
            this.mmapEnabled = mmapEnabled;
        }

        public String getDataDirectory() { return dataDirectory; }
        public boolean isMmapEnabled() { return mmapEnabled; }

        public String getJobsDbPath() { return resolve(JOBS_DB); }
        public String getRulesDbPath() { return resolve(RULES_DB); }
        public String getInvocationsDbPath() { return resolve(INVOCATIONS_DB); }

        private String resolve(String fileName) {
            return new File(dataDirectory, fileName).getPath();
        }
    }

    /**
     * Timer configuration
     */
    public static class TimerConfig {
        private final Duration tickInterval;
        private final boolean wakeLoopEnabled;

        public TimerConfig(Duration tickInterval, boolean wakeLoopEnabled) {
            this.tickInterval = tickInterval;
            this.wakeLoopEnabled = wakeLoopEnabled;
        }

        public Duration getTickInterval() { return tickInterval; }

        /**
         * Whether the runtime starts the background wake loop. When disabled, due rules
         * fire only through explicit ticks.
         */
        public boolean isWakeLoopEnabled() { return wakeLoopEnabled; }
    }

    /**
     * Dispatch configuration
     */
    public static class DispatchConfig {
        private final Duration executionTimeout;
        private final boolean asyncDispatch;
        private final int defaultInvocationLimit;
        private final int defaultListLimit;
        private final Duration simulatedWorkDelay;
        private final String reportBaseUrl;

        public DispatchConfig(Duration executionTimeout, boolean asyncDispatch,
                              int defaultInvocationLimit, int defaultListLimit,
                              Duration simulatedWorkDelay, String reportBaseUrl) {
            this.executionTimeout = executionTimeout;
            this.asyncDispatch = asyncDispatch;
            this.defaultInvocationLimit = defaultInvocationLimit;
            this.defaultListLimit = defaultListLimit;
            this.simulatedWorkDelay = simulatedWorkDelay;
            this.reportBaseUrl = reportBaseUrl;
        }

        public Duration getExecutionTimeout() { return executionTimeout; }

        /**
         * Whether immediate jobs and timer fires are dispatched on the dispatch pool
         * rather than on the calling thread
         */
        public boolean isAsyncDispatch() { return asyncDispatch; }
        public int getDefaultInvocationLimit() { return defaultInvocationLimit; }
        public int getDefaultListLimit() { return defaultListLimit; }
        public Duration getSimulatedWorkDelay() { return simulatedWorkDelay; }
        public String getReportBaseUrl() { return reportBaseUrl; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;
        private final Duration healthCheckInterval;

        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks,
                                Duration healthCheckInterval) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
            this.healthCheckInterval = healthCheckInterval;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private StorageConfig storageConfig = Defaults.defaultStorageConfig();
        private TimerConfig timerConfig = Defaults.defaultTimerConfig();
        private DispatchConfig dispatchConfig = Defaults.defaultDispatchConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();

        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }

        public Builder storageConfig(StorageConfig storageConfig) {
            this.storageConfig = storageConfig;
            return this;
        }

        public Builder dataDirectory(String dataDirectory) {
            this.storageConfig = new StorageConfig(dataDirectory, storageConfig.isMmapEnabled());
            return this;
        }

        public Builder timerConfig(TimerConfig timerConfig) {
            this.timerConfig = timerConfig;
            return this;
        }

        public Builder dispatchConfig(DispatchConfig dispatchConfig) {
            this.dispatchConfig = dispatchConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(executorConfig, storageConfig, timerConfig,
                                       dispatchConfig, monitoringConfig);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static final int DEFAULT_INVOCATION_LIMIT = 50;
        public static final int DEFAULT_LIST_LIMIT = 100;

        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(
                4, 16, Duration.ofMinutes(1), 1000, Duration.ofSeconds(30)
            );
        }

        public static StorageConfig defaultStorageConfig() {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String uniqueName = java.util.UUID.randomUUID().toString();
            return new StorageConfig(new File(tmpDir, "job-scheduler-" + uniqueName).getPath(), true);
        }

        public static TimerConfig defaultTimerConfig() {
            return new TimerConfig(Duration.ofSeconds(1), true);
        }

        public static DispatchConfig defaultDispatchConfig() {
            return new DispatchConfig(
                Duration.ofMinutes(5), true, DEFAULT_INVOCATION_LIMIT, DEFAULT_LIST_LIMIT,
                Duration.ofSeconds(1), "https://example.com/reports/"
            );
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true, Duration.ofMinutes(1));
        }
    }
}
