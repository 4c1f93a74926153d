package com.enterprise.jobscheduler.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trigger policy of a job. Fixed at creation time.
 */
public enum JobType {
    IMMEDIATE("immediate"),  // Dispatched once, right after creation
    ONCE("once"),            // Dispatched once at executeAt
    CRON("cron");            // Dispatched on every match of the schedule expression

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolve a wire value, returning null when it names no job type
     */
    @JsonCreator
    public static JobType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (JobType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
