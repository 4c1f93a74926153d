package com.enterprise.jobscheduler.store;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobFilter;
import com.enterprise.jobscheduler.core.JobStatusUpdate;
import com.enterprise.jobscheduler.exception.JobNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of job definitions and their lifecycle status.
 */
public interface JobStore {

    /**
     * Persists a new job record.
     *
     * @param job a fully validated job
     * @return the stored job
     */
    Job createJob(Job job);

    /**
     * Retrieves a job by ID.
     *
     * @param jobId the job ID
     * @return Optional containing the job if found
     */
    Optional<Job> getJob(UUID jobId);

    /**
     * Lists jobs matching the filter, newest created first.
     *
     * @param filter equality filter on type and status
     * @param limit  maximum number of jobs to return
     * @return matching jobs
     */
    List<Job> listJobs(JobFilter filter, int limit);

    /**
     * Atomically applies a partial status update.
     *
     * @param jobId  the job ID
     * @param update status, invocation increment and timestamps
     * @return the job after the update
     * @throws JobNotFoundException if the job no longer exists
     */
    Job updateJobStatus(UUID jobId, JobStatusUpdate update) throws JobNotFoundException;

    /**
     * Records the timer rule registered for a job.
     *
     * @throws JobNotFoundException if the job no longer exists
     */
    Job attachRule(UUID jobId, String ruleId) throws JobNotFoundException;

    /**
     * Removes a job record.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    void deleteJob(UUID jobId) throws JobNotFoundException;

    /**
     * Number of stored jobs.
     */
    int size();

    /**
     * Closes the store and releases resources.
     */
    void close();
}
