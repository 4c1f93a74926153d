package com.enterprise.jobscheduler.exception;

/**
 * Base exception for job scheduling related errors
 */
public class JobSchedulerException extends Exception {

    public JobSchedulerException(String message) {
        super(message);
    }

    public JobSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
