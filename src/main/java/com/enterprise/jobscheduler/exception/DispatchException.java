package com.enterprise.jobscheduler.exception;

import java.util.UUID;

/**
 * Exception thrown when dispatch bookkeeping fails unexpectedly
 */
public class DispatchException extends JobSchedulerException {

    private final UUID jobId;

    public DispatchException(UUID jobId, Throwable cause) {
        super("Dispatch failed for job " + jobId + ": " + cause.getMessage(), cause);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
