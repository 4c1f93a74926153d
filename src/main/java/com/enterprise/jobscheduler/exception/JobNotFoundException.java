package com.enterprise.jobscheduler.exception;

import java.util.UUID;

/**
 * Exception thrown when a requested job does not exist
 */
public class JobNotFoundException extends JobSchedulerException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
