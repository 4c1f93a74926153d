package com.enterprise.jobscheduler.ledger;

import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only history of execution attempts per job.
 */
public interface InvocationLedger {

    /**
     * Window used by {@link #statistics(UUID)}
     */
    int DEFAULT_STATISTICS_LIMIT = 50;

    /**
     * Appends a new invocation.
     *
     * @param invocation the invocation, normally RUNNING
     * @return the stored invocation with its ledger sequence assigned
     */
    Invocation recordInvocation(Invocation invocation);

    /**
     * Finalizes a stored RUNNING invocation.
     *
     * @param invocation the finalized invocation
     * @throws IllegalStateException if the stored invocation is missing or already finalized
     */
    void updateInvocation(Invocation invocation);

    /**
     * Retrieves an invocation by ID.
     */
    Optional<Invocation> getInvocation(UUID invocationId);

    /**
     * Invocations of one job, optionally filtered by status.
     *
     * @param jobId        the job ID
     * @param statusFilter status to match, or null for all
     * @param limit        maximum number of invocations
     * @param newestFirst  order by start time descending when true
     * @return matching invocations
     */
    List<Invocation> queryByJob(UUID jobId, InvocationStatus statusFilter, int limit, boolean newestFirst);

    /**
     * Statistics over the most recent {@code limit} invocations of a job.
     * This is a windowed figure, not a full-history aggregate.
     */
    default InvocationStatistics statistics(UUID jobId, int limit) {
        return InvocationStatistics.of(queryByJob(jobId, null, limit, true));
    }

    /**
     * Statistics over the most recent {@value #DEFAULT_STATISTICS_LIMIT} invocations of a job.
     */
    default InvocationStatistics statistics(UUID jobId) {
        return statistics(jobId, DEFAULT_STATISTICS_LIMIT);
    }

    /**
     * Total number of stored invocations.
     */
    int size();

    /**
     * Closes the ledger and releases resources.
     */
    void close();
}
