package com.enterprise.jobscheduler.core;

/**
 * Equality filter on job type and status. Null fields match everything.
 */
public class JobFilter {

    private static final JobFilter ALL = new JobFilter(null, null);

    private final JobType type;
    private final JobStatus status;

    public JobFilter(JobType type, JobStatus status) {
        this.type = type;
        this.status = status;
    }

    public static JobFilter all() {
        return ALL;
    }

    public static JobFilter byType(JobType type) {
        return new JobFilter(type, null);
    }

    public static JobFilter byStatus(JobStatus status) {
        return new JobFilter(null, status);
    }

    public JobType getType() { return type; }

    public JobStatus getStatus() { return status; }

    public boolean matches(Job job) {
        return (type == null || type == job.getType())
            && (status == null || status == job.getStatus());
    }

    @Override
    public String toString() {
        return "JobFilter{type=" + type + ", status=" + status + '}';
    }
}
