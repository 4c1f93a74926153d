package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.exception.JobExecutionException;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Base class for the built-in handlers: a clock for output timestamps and a simulated work delay.
 */
public abstract class AbstractActionHandler implements ActionHandler {

    protected final Clock clock;
    protected final Duration workDelay;

    protected AbstractActionHandler(Clock clock, Duration workDelay) {
        this.clock = clock;
        this.workDelay = workDelay != null ? workDelay : Duration.ZERO;
    }

    protected void simulateWork() throws JobExecutionException {
        if (workDelay.isZero() || workDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(workDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException(getSupportedAction() + " interrupted", e);
        }
    }

    protected String now() {
        return clock.instant().toString();
    }

    protected static String stringValue(Map<String, Object> input, String key, String defaultValue) {
        Object value = input.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
