package com.enterprise.jobscheduler.service;

import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobFilter;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.JobType;
import com.enterprise.jobscheduler.dispatch.Dispatcher;
import com.enterprise.jobscheduler.exception.DispatchException;
import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.JobValidationException;
import com.enterprise.jobscheduler.exception.SchedulingException;
import com.enterprise.jobscheduler.ledger.InvocationLedger;
import com.enterprise.jobscheduler.ledger.InvocationStatistics;
import com.enterprise.jobscheduler.monitoring.MetricsCollector;
import com.enterprise.jobscheduler.store.JobStore;
import com.enterprise.jobscheduler.timer.Rule;
import com.enterprise.jobscheduler.timer.RuleEngine;
import com.enterprise.jobscheduler.timer.ScheduleExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Create, list, fetch and delete jobs.
 *
 * <p>Requests are fully validated before anything is written. A job is written before its
 * rule is registered, so a registration failure leaves a scheduled job without a rule
 * rather than a rule without a job.
 */
public class JobService {

    private static final Logger logger = LoggerFactory.getLogger(JobService.class);

    private final JobStore jobStore;
    private final RuleEngine ruleEngine;
    private final InvocationLedger ledger;
    private final Dispatcher dispatcher;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final int defaultListLimit;
    private final int defaultInvocationLimit;

    public JobService(JobStore jobStore, RuleEngine ruleEngine, InvocationLedger ledger,
                      Dispatcher dispatcher, MetricsCollector metrics, Clock clock,
                      int defaultListLimit, int defaultInvocationLimit) {
        this.jobStore = jobStore;
        this.ruleEngine = ruleEngine;
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultListLimit = defaultListLimit;
        this.defaultInvocationLimit = defaultInvocationLimit;
    }

    /**
     * Validate and store a job, then start it: immediate jobs are dispatched,
     * once and cron jobs get a timer rule.
     *
     * @return the stored job, with its rule ID when one was registered
     * @throws JobValidationException if the request is invalid; nothing is stored
     * @throws SchedulingException    if the rule cannot be registered; the job stays stored without a rule
     */
    public Job createJob(JobRequest request) throws JobValidationException, SchedulingException {
        Instant now = clock.instant();
        JobType type = validateType(request);
        Instant executeAt = type == JobType.ONCE ? validateExecuteAt(request.getExecuteAt(), now) : null;
        if (type == JobType.CRON) {
            validateScheduleExpression(request.getScheduleExpression(), now);
        }

        Job job = jobStore.createJob(Job.builder()
            .name(request.getName())
            .description(request.getDescription())
            .type(type)
            .scheduleExpression(type == JobType.CRON ? request.getScheduleExpression().trim() : null)
            .executeAt(executeAt)
            .payload(request.getPayload())
            .createdAt(now)
            .updatedAt(now)
            .build());

        metrics.recordJobCreated(type);
        metrics.updateStoredJobs(jobStore.size());
        logger.info("Job {} ({}) created as {}", job.getId(), job.getName(), type.value());

        switch (type) {
            case IMMEDIATE:
                startImmediate(job);
                return job;
            case ONCE:
                return attach(job, ruleEngine.registerOneShot(job.getId(), executeAt, job.getPayload()));
            case CRON:
                return attach(job, ruleEngine.registerRecurring(job.getId(), job.getScheduleExpression(),
                                                                job.getPayload()));
            default:
                throw new IllegalStateException("Unhandled job type " + type);
        }
    }

    private void startImmediate(Job job) {
        if (dispatcher.isAsyncDispatch()) {
            dispatcher.submit(job.getId(), job.getPayload()).whenComplete((invocation, error) -> {
                if (error != null) {
                    logger.error("Immediate dispatch of job {} failed", job.getId(), error);
                }
            });
            return;
        }
        try {
            dispatcher.dispatch(job.getId(), job.getPayload());
        } catch (DispatchException e) {
            logger.error("Immediate dispatch of job {} failed", job.getId(), e);
        }
    }

    private Job attach(Job job, String ruleId) throws SchedulingException {
        metrics.updateRegisteredRules(ruleEngine.listRules().size());
        try {
            return jobStore.attachRule(job.getId(), ruleId);
        } catch (JobNotFoundException e) {
            unregisterQuietly(ruleId, job.getId());
            throw new SchedulingException("Job " + job.getId() + " was deleted while its rule was registered", e);
        }
    }

    private JobType validateType(JobRequest request) throws JobValidationException {
        if (isBlank(request.getName()) || isBlank(request.getType())) {
            throw new JobValidationException(isBlank(request.getName()) ? "name" : "type",
                "name and type are required fields");
        }
        JobType type = JobType.fromValue(request.getType());
        if (type == null) {
            throw new JobValidationException("type", "Invalid job type. Must be: immediate, once, or cron");
        }
        return type;
    }

    private Instant validateExecuteAt(String executeAt, Instant now) throws JobValidationException {
        if (isBlank(executeAt)) {
            throw new JobValidationException("executeAt", "executeAt is required for once type jobs (ISO 8601 format)");
        }
        Instant parsed = parseInstant(executeAt.trim());
        if (parsed == null) {
            throw new JobValidationException("executeAt",
                "Invalid executeAt format. Use ISO 8601 (e.g., 2026-01-15T10:00:00Z)");
        }
        if (!parsed.isAfter(now)) {
            throw new JobValidationException("executeAt", "executeAt must be in the future");
        }
        return parsed;
    }

    /**
     * ISO-8601 instant, offset date-time, or local date-time taken as UTC
     */
    static Instant parseInstant(String value) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable executeAt '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private void validateScheduleExpression(String expression, Instant now) throws JobValidationException {
        ScheduleExpression schedule = ScheduleExpression.parse(expression);
        if (schedule.nextFireAfter(now, now) == null) {
            throw new JobValidationException("scheduleExpression",
                "Schedule expression never fires: " + expression);
        }
    }

    public Optional<Job> getJob(UUID jobId) {
        return jobStore.getJob(jobId);
    }

    /**
     * A job with its most recent invocations, newest first, and statistics over them
     *
     * @param invocationLimit  maximum invocations, null for the default
     * @param invocationStatus status filter as a wire value, null for all;
     *                         an unknown value matches no invocation
     */
    public JobDetails getJobDetails(UUID jobId, Integer invocationLimit, String invocationStatus)
            throws JobNotFoundException {
        Job job = jobStore.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        int limit = invocationLimit != null ? invocationLimit : defaultInvocationLimit;

        List<Invocation> invocations;
        if (invocationStatus == null) {
            invocations = ledger.queryByJob(jobId, null, limit, true);
        } else {
            InvocationStatus status = InvocationStatus.fromValue(invocationStatus);
            invocations = status != null ? ledger.queryByJob(jobId, status, limit, true) : List.of();
        }

        return new JobDetails(job, invocations, InvocationStatistics.of(invocations));
    }

    /**
     * Jobs newest first, filtered by wire values of type and status.
     * An unknown filter value matches no job.
     */
    public List<Job> listJobs(String type, String status, Integer limit) {
        JobType typeFilter = JobType.fromValue(type);
        JobStatus statusFilter = JobStatus.fromValue(status);
        if ((type != null && typeFilter == null) || (status != null && statusFilter == null)) {
            logger.debug("Unknown job filter type={} status={}, returning no jobs", type, status);
            return List.of();
        }
        return jobStore.listJobs(new JobFilter(typeFilter, statusFilter),
                                 limit != null ? limit : defaultListLimit);
    }

    /**
     * Remove a job's rule, then the job. Rule removal failures are logged and do not block deletion.
     * Invocation history is kept.
     *
     * @return the deleted job
     * @throws JobNotFoundException if the job does not exist; nothing is changed
     */
    public Job deleteJob(UUID jobId) throws JobNotFoundException {
        Job job = jobStore.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.getType() != JobType.IMMEDIATE) {
            // A job may hold a registered rule without a recorded ruleId if attaching failed
            String ruleId = job.getRuleId() != null ? job.getRuleId() : Rule.idFor(jobId);
            unregisterQuietly(ruleId, jobId);
            metrics.updateRegisteredRules(ruleEngine.listRules().size());
        }

        jobStore.deleteJob(jobId);
        metrics.recordJobDeleted(job.getType());
        metrics.updateStoredJobs(jobStore.size());
        logger.info("Job {} ({}) deleted", jobId, job.getName());
        return job;
    }

    private void unregisterQuietly(String ruleId, UUID jobId) {
        try {
            ruleEngine.unregister(ruleId);
        } catch (SchedulingException e) {
            logger.error("Failed to remove rule {} of job {}", ruleId, jobId, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
