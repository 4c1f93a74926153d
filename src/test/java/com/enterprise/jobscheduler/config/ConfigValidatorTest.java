package com.enterprise.jobscheduler.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    private static List<String> fields(List<ConfigValidator.ValidationError> errors) {
        return errors.stream().map(ConfigValidator.ValidationError::getField).collect(Collectors.toList());
    }

    @Test
    void testDefaultConfigIsValid() {
        assertTrue(validator.validate(SchedulerConfig.builder().build()).isEmpty());
    }

    @Test
    void testInvalidExecutorConfig() {
        SchedulerConfig config = SchedulerConfig.builder()
            .executorConfig(new SchedulerConfig.ExecutorConfig(8, 4, Duration.ofSeconds(-1), 0, Duration.ofSeconds(5)))
            .build();

        List<String> fields = fields(validator.validate(config));

        assertTrue(fields.contains("executor.poolSize"));
        assertTrue(fields.contains("executor.keepAliveTime"));
        assertTrue(fields.contains("executor.queueCapacity"));
        assertFalse(fields.contains("executor.corePoolSize"));
    }

    @Test
    void testInvalidStorageAndTimerConfig() {
        SchedulerConfig config = SchedulerConfig.builder()
            .dataDirectory(" ")
            .timerConfig(new SchedulerConfig.TimerConfig(Duration.ZERO, true))
            .build();

        List<String> fields = fields(validator.validate(config));

        assertEquals(List.of("storage.dataDirectory", "timer.tickInterval"), fields);
    }

    @Test
    void testInvalidDispatchConfig() {
        SchedulerConfig config = SchedulerConfig.builder()
            .dispatchConfig(new SchedulerConfig.DispatchConfig(Duration.ZERO, true, 0, -1, Duration.ofMillis(-5), ""))
            .build();

        List<String> fields = fields(validator.validate(config));

        assertEquals(List.of("dispatch.executionTimeout", "dispatch.defaultInvocationLimit",
                             "dispatch.defaultListLimit", "dispatch.simulatedWorkDelay", "dispatch.reportBaseUrl"),
                     fields);
    }

    @Test
    void testNegativeHealthCheckInterval() {
        SchedulerConfig config = SchedulerConfig.builder()
            .monitoringConfig(new SchedulerConfig.MonitoringConfig(true, true, Duration.ofSeconds(-1)))
            .build();

        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        assertEquals(1, errors.size());
        assertEquals("monitoring.healthCheckInterval", errors.get(0).getField());
        assertEquals("Health check interval cannot be negative", errors.get(0).getMessage());
    }
}
