package com.enterprise.jobscheduler.dispatch;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.JobStatusUpdate;
import com.enterprise.jobscheduler.core.JobType;
import com.enterprise.jobscheduler.exception.DispatchException;
import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.SchedulingException;
import com.enterprise.jobscheduler.ledger.InvocationLedger;
import com.enterprise.jobscheduler.logic.JobLogic;
import com.enterprise.jobscheduler.monitoring.MetricsCollector;
import com.enterprise.jobscheduler.store.JobStore;
import com.enterprise.jobscheduler.timer.FireListener;
import com.enterprise.jobscheduler.timer.FireSignal;
import com.enterprise.jobscheduler.timer.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns a timer fire or an immediate submission into one recorded execution attempt.
 *
 * <p>Each dispatch loads the job, records a RUNNING invocation, calls the job logic through
 * the {@link JobExecutor}, finalizes the invocation and updates the job's status and counters.
 * Fires may be delivered more than once; every delivery produces its own invocation.
 */
public class Dispatcher implements FireListener {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final JobStore jobStore;
    private final InvocationLedger ledger;
    private final RuleEngine ruleEngine;
    private final JobLogic jobLogic;
    private final JobExecutor executor;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final boolean asyncDispatch;

    public Dispatcher(JobStore jobStore, InvocationLedger ledger, RuleEngine ruleEngine,
                      JobLogic jobLogic, JobExecutor executor, MetricsCollector metrics,
                      Clock clock, boolean asyncDispatch) {
        this.jobStore = jobStore;
        this.ledger = ledger;
        this.ruleEngine = ruleEngine;
        this.jobLogic = jobLogic;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
        this.asyncDispatch = asyncDispatch;
    }

    /**
     * Dispatch a job synchronously.
     *
     * @param jobId   the job to execute
     * @param payload the invocation input, or null to use the job's stored payload
     * @return the finalized invocation, or empty if the job no longer exists
     * @throws DispatchException if bookkeeping around the call fails unexpectedly
     */
    public Optional<Invocation> dispatch(UUID jobId, Map<String, Object> payload) throws DispatchException {
        Instant startedAt = clock.instant();
        Job job;
        Invocation running;

        try {
            Optional<Job> found = jobStore.getJob(jobId);
            if (found.isEmpty()) {
                logger.warn("Job {} not found, skipping dispatch", jobId);
                return Optional.empty();
            }
            job = found.get();
            Map<String, Object> input = payload != null ? payload : job.getPayload();

            running = ledger.recordInvocation(Invocation.running(jobId, startedAt, input));
            metrics.recordInvocationStarted();
            logger.info("Executing job {} ({}, type {}) as invocation {}",
                       jobId, job.getName(), job.getType().value(), running.getId());

        } catch (RuntimeException e) {
            throw dispatchFailed(jobId, startedAt, null, e);
        }

        ExecutionOutcome outcome = executor.execute(job, running.getInput(), jobLogic);

        Invocation finalized;
        try {
            Instant completedAt = clock.instant();
            finalized = outcome.isSuccess()
                ? running.complete(outcome.getOutput(), completedAt)
                : running.fail(outcome.getErrorMessage(), stackTraceOf(outcome.getException()),
                               outcome.getErrorKind(), completedAt);
            ledger.updateInvocation(finalized);
            recordOutcome(job, finalized);

            updateJob(job, outcome.isSuccess(), completedAt);

        } catch (RuntimeException e) {
            throw dispatchFailed(jobId, startedAt, running, e);
        }

        if (job.getType() == JobType.ONCE) {
            removeRule(job);
        }

        logger.info("Invocation {} of job {} finished as {} in {}ms",
                   finalized.getId(), jobId, finalized.getStatus().value(), finalized.getDurationMs());
        return Optional.of(finalized);
    }

    /**
     * Dispatch a job asynchronously on the dispatch pool.
     * A rejected submission is recorded as a failed invocation before the returned future fails.
     */
    public CompletableFuture<Optional<Invocation>> submit(UUID jobId, Map<String, Object> payload) {
        try {
            return executor.submit(() -> dispatch(jobId, payload));
        } catch (RejectedExecutionException e) {
            return dispatchRejected(jobId, e);
        }
    }

    @Override
    public void onFire(FireSignal signal) {
        metrics.recordRuleFired(signal.getRuleId());

        if (asyncDispatch) {
            submit(signal.getJobId(), signal.getInput()).whenComplete((result, error) -> {
                if (error != null) {
                    logger.error("Dispatch of rule {} for job {} failed", signal.getRuleId(), signal.getJobId(), error);
                }
            });
            return;
        }

        try {
            dispatch(signal.getJobId(), signal.getInput());
        } catch (DispatchException e) {
            logger.error("Dispatch of rule {} for job {} failed", signal.getRuleId(), signal.getJobId(), e);
        }
    }

    public boolean isAsyncDispatch() {
        return asyncDispatch;
    }

    private void updateJob(Job job, boolean success, Instant completedAt) {
        JobStatus newStatus = nextStatus(job.getType(), success);
        try {
            jobStore.updateJobStatus(job.getId(), JobStatusUpdate.executed(newStatus, completedAt));
            logger.debug("Job {} status set to {}", job.getId(), newStatus.value());
        } catch (JobNotFoundException e) {
            logger.warn("Job {} was deleted during execution, status not updated", job.getId());
        }
    }

    /**
     * Status after one execution: immediate and once jobs end, cron jobs stay scheduled
     */
    static JobStatus nextStatus(JobType type, boolean success) {
        if (type == JobType.CRON) {
            return JobStatus.SCHEDULED;
        }
        return success ? JobStatus.COMPLETED : JobStatus.FAILED;
    }

    private void removeRule(Job job) {
        if (job.getRuleId() == null) {
            return;
        }
        try {
            ruleEngine.unregister(job.getRuleId());
            logger.debug("Removed rule {} of once job {}", job.getRuleId(), job.getId());
        } catch (SchedulingException e) {
            logger.error("Failed to remove rule {} of once job {}", job.getRuleId(), job.getId(), e);
        }
    }

    private void recordOutcome(Job job, Invocation finalized) {
        long durationMs = finalized.getDurationMs() != null ? finalized.getDurationMs() : 0;
        if (finalized.getStatus() == InvocationStatus.COMPLETED) {
            metrics.recordInvocationCompleted(job.getType(), durationMs);
        } else {
            metrics.recordInvocationFailed(job.getType(), finalized.getErrorKind(), durationMs);
        }
    }

    private CompletableFuture<Optional<Invocation>> dispatchRejected(UUID jobId, RejectedExecutionException cause) {
        Instant rejectedAt = clock.instant();
        Optional<Job> job;
        try {
            job = jobStore.getJob(jobId);
        } catch (RuntimeException e) {
            logger.error("Failed to load job {} after rejected dispatch", jobId, e);
            return CompletableFuture.failedFuture(dispatchFailed(jobId, rejectedAt, null, cause));
        }
        if (job.isEmpty()) {
            logger.warn("Job {} not found, skipping rejected dispatch", jobId);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        DispatchException failure = dispatchFailed(jobId, rejectedAt, null, cause);
        try {
            updateJob(job.get(), false, rejectedAt);
        } catch (RuntimeException e) {
            logger.error("Failed to update job {} after rejected dispatch", jobId, e);
        }
        if (job.get().getType() == JobType.ONCE) {
            removeRule(job.get());
        }
        return CompletableFuture.failedFuture(failure);
    }

    /**
     * Best-effort write of a failed invocation, then the exception for the caller
     */
    private DispatchException dispatchFailed(UUID jobId, Instant startedAt, Invocation running, RuntimeException cause) {
        logger.error("Critical error dispatching job {}", jobId, cause);
        metrics.recordDispatchError(jobId);

        try {
            Instant completedAt = clock.instant();
            if (running != null && ledger.getInvocation(running.getId())
                    .map(stored -> !stored.isFinalized()).orElse(false)) {
                ledger.updateInvocation(running.fail(cause.getMessage(), Invocation.stackTraceOf(cause),
                                                     ErrorKind.DISPATCH, completedAt));
                metrics.recordInvocationAborted();
            } else if (running == null) {
                ledger.recordInvocation(Invocation.failedImmediately(jobId, startedAt, completedAt, cause));
            }
        } catch (RuntimeException recordError) {
            logger.error("Failed to record failed invocation for job {}", jobId, recordError);
        }

        return new DispatchException(jobId, cause);
    }

    private static String stackTraceOf(Throwable error) {
        return error != null ? Invocation.stackTraceOf(error) : null;
    }
}
