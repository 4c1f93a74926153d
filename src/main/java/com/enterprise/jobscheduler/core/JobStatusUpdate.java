package com.enterprise.jobscheduler.core;

import java.time.Instant;

/**
 * Partial update applied atomically to a stored job.
 * The invocation increment is added to the stored counter, never written as an absolute value.
 */
public class JobStatusUpdate {

    private final JobStatus status;
    private final long invocationIncrement;
    private final Instant lastExecutedAt;
    private final Instant updatedAt;

    public JobStatusUpdate(JobStatus status, long invocationIncrement,
                           Instant lastExecutedAt, Instant updatedAt) {
        if (invocationIncrement < 0) {
            throw new IllegalArgumentException("Invocation increment cannot be negative");
        }
        this.status = status;
        this.invocationIncrement = invocationIncrement;
        this.lastExecutedAt = lastExecutedAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Update recorded after one execution attempt finished at the given time
     */
    public static JobStatusUpdate executed(JobStatus status, Instant completedAt) {
        return new JobStatusUpdate(status, 1, completedAt, completedAt);
    }

    public static JobStatusUpdate statusOnly(JobStatus status, Instant updatedAt) {
        return new JobStatusUpdate(status, 0, null, updatedAt);
    }

    public JobStatus getStatus() { return status; }

    public long getInvocationIncrement() { return invocationIncrement; }

    public Instant getLastExecutedAt() { return lastExecutedAt; }

    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "JobStatusUpdate{" +
                "status=" + status +
                ", invocationIncrement=" + invocationIncrement +
                ", lastExecutedAt=" + lastExecutedAt +
                '}';
    }
}
