package com.enterprise.jobscheduler.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a job
 */
public enum JobStatus {
    SCHEDULED("scheduled"),    // Waiting for its rule to fire
    EXECUTING("executing"),    // Immediate job waiting for its single dispatch
    COMPLETED("completed"),    // Terminal, last run succeeded
    FAILED("failed");          // Terminal, last run failed

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
