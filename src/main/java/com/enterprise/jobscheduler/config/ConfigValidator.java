package com.enterprise.jobscheduler.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates job scheduler configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(SchedulerConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateStorageConfig(config.getStorageConfig(), errors);
        validateTimerConfig(config.getTimerConfig(), errors);
        validateDispatchConfig(config.getDispatchConfig(), errors);
        validateMonitoringConfig(config.getMonitoringConfig(), errors);

        return errors;
    }

    private void validateExecutorConfig(SchedulerConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("executor", "Executor configuration is required"));
            return;
        }

        if (config.getCorePoolSize() <= 0) {
            errors.add(new ValidationError("executor.corePoolSize",
                "Core pool size must be greater than 0"));
        }

        if (config.getMaximumPoolSize() <= 0) {
            errors.add(new ValidationError("executor.maximumPoolSize",
                "Maximum pool size must be greater than 0"));
        }

        if (config.getCorePoolSize() > config.getMaximumPoolSize()) {
            errors.add(new ValidationError("executor.poolSize",
                "Core pool size cannot be greater than maximum pool size"));
        }

        if (config.getKeepAliveTime() == null || config.getKeepAliveTime().isNegative()) {
            errors.add(new ValidationError("executor.keepAliveTime",
                "Keep alive time cannot be negative"));
        }

        if (config.getQueueCapacity() <= 0) {
            errors.add(new ValidationError("executor.queueCapacity",
                "Queue capacity must be greater than 0"));
        }

        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("executor.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }

    private void validateStorageConfig(SchedulerConfig.StorageConfig config, List<ValidationError> errors) {
        if (config == null || config.getDataDirectory() == null || config.getDataDirectory().trim().isEmpty()) {
            errors.add(new ValidationError("storage.dataDirectory",
                "Data directory is required"));
        }
    }

    private void validateTimerConfig(SchedulerConfig.TimerConfig config, List<ValidationError> errors) {
        if (config == null || config.getTickInterval() == null
                || config.getTickInterval().isNegative() || config.getTickInterval().isZero()) {
            errors.add(new ValidationError("timer.tickInterval",
                "Tick interval must be greater than 0"));
        }
    }

    private void validateDispatchConfig(SchedulerConfig.DispatchConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("dispatch", "Dispatch configuration is required"));
            return;
        }

        if (config.getExecutionTimeout() == null
                || config.getExecutionTimeout().isNegative() || config.getExecutionTimeout().isZero()) {
            errors.add(new ValidationError("dispatch.executionTimeout",
                "Execution timeout must be greater than 0"));
        }

        if (config.getDefaultInvocationLimit() <= 0) {
            errors.add(new ValidationError("dispatch.defaultInvocationLimit",
                "Default invocation limit must be greater than 0"));
        }

        if (config.getDefaultListLimit() <= 0) {
            errors.add(new ValidationError("dispatch.defaultListLimit",
                "Default list limit must be greater than 0"));
        }

        if (config.getSimulatedWorkDelay() == null || config.getSimulatedWorkDelay().isNegative()) {
            errors.add(new ValidationError("dispatch.simulatedWorkDelay",
                "Simulated work delay cannot be negative"));
        }

        if (config.getReportBaseUrl() == null || config.getReportBaseUrl().trim().isEmpty()) {
            errors.add(new ValidationError("dispatch.reportBaseUrl",
                "Report base URL is required"));
        }
    }

    private void validateMonitoringConfig(SchedulerConfig.MonitoringConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("monitoring", "Monitoring configuration is required"));
            return;
        }

        if (config.getHealthCheckInterval() == null || config.getHealthCheckInterval().isNegative()) {
            errors.add(new ValidationError("monitoring.healthCheckInterval",
                "Health check interval cannot be negative"));
        }
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
