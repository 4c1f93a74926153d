package com.enterprise.jobscheduler.exception;

/**
 * Exception thrown by job logic. The dispatcher records it as a failed invocation.
 */
public class JobExecutionException extends JobSchedulerException {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
