package com.enterprise.jobscheduler.exception;

/**
 * Exception thrown when a job request or schedule expression is malformed.
 * Never retried.
 */
public class JobValidationException extends JobSchedulerException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public JobValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
