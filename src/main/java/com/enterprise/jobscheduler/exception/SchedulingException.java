package com.enterprise.jobscheduler.exception;

/**
 * Exception thrown when a timer rule cannot be registered or removed
 */
public class SchedulingException extends JobSchedulerException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
