package com.enterprise.jobscheduler.service;

import com.enterprise.jobscheduler.JobScheduler;
import com.enterprise.jobscheduler.JobSchedulerFactory;
import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.JobType;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.JobValidationException;
import com.enterprise.jobscheduler.support.MutableClock;
import com.enterprise.jobscheduler.support.TestConfigs;
import com.enterprise.jobscheduler.timer.RuleEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JobScheduler scheduler;
    private JobService service;
    private RuleEngine ruleEngine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-15T10:00:00Z");
        scheduler = JobSchedulerFactory.create(TestConfigs.deterministic(tempDir), clock, (job, input) -> {
            if (Boolean.TRUE.equals(input.get("fail"))) {
                throw new JobExecutionException("requested failure");
            }
            return Map.of("echo", input);
        });
        service = scheduler.getJobService();
        ruleEngine = scheduler.getRuleEngine();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    private static JobRequest.Builder request(String type) {
        return JobRequest.builder().name(type + "-job").type(type);
    }

    private void assertRejected(JobRequest request, String field, String message) {
        JobValidationException e = assertThrows(JobValidationException.class, () -> service.createJob(request));
        assertEquals(field, e.getField());
        assertEquals(message, e.getMessage());
        assertEquals(0, scheduler.getJobStore().size());
        assertTrue(ruleEngine.listRules().isEmpty());
    }

    @Test
    void testValidationRejectsWithoutPersisting() {
        assertRejected(JobRequest.builder().type("once").build(), "name", "name and type are required fields");
        assertRejected(JobRequest.builder().name("x").build(), "type", "name and type are required fields");
        assertRejected(request("weekly").build(), "type", "Invalid job type. Must be: immediate, once, or cron");
        assertRejected(request("once").build(), "executeAt",
                       "executeAt is required for once type jobs (ISO 8601 format)");
        assertRejected(request("once").executeAt("tomorrow").build(), "executeAt",
                       "Invalid executeAt format. Use ISO 8601 (e.g., 2026-01-15T10:00:00Z)");
        assertRejected(request("once").executeAt("2026-01-15T10:00:00Z").build(), "executeAt",
                       "executeAt must be in the future");
        assertRejected(request("once").executeAt("2026-01-15T09:00:00Z").build(), "executeAt",
                       "executeAt must be in the future");
        assertRejected(request("cron").build(), "scheduleExpression",
                       "scheduleExpression is required for cron type jobs");
        assertThrows(JobValidationException.class,
            () -> service.createJob(request("cron").scheduleExpression("every tuesday").build()));
        assertEquals(0, scheduler.getJobStore().size());
    }

    @Test
    void testExecuteAtFormats() {
        assertEquals(Instant.parse("2026-01-15T10:01:00Z"), JobService.parseInstant("2026-01-15T10:01:00Z"));
        assertEquals(Instant.parse("2026-01-15T09:01:00Z"), JobService.parseInstant("2026-01-15T10:01:00+01:00"));
        assertEquals(Instant.parse("2026-01-15T10:01:00Z"), JobService.parseInstant("2026-01-15T10:01:00"));
        assertEquals(Instant.parse("2026-01-15T10:01:00.500Z"), JobService.parseInstant("2026-01-15T10:01:00.500Z"));
        assertNull(JobService.parseInstant("2026-01-15"));
        assertNull(JobService.parseInstant("not a date"));
    }

    @Test
    void testImmediateJobRunsOnCreate() throws Exception {
        Job created = service.createJob(request("immediate").payload(Map.of("k", "v")).build());
        assertEquals(JobStatus.EXECUTING, created.getStatus());
        assertNull(created.getRuleId());

        Job job = service.getJob(created.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(1, job.getInvocationCount());

        JobDetails details = service.getJobDetails(created.getId(), null, null);
        assertEquals(1, details.getInvocations().size());
        assertEquals(Map.of("echo", Map.of("k", "v")), details.getInvocations().get(0).getOutput());
        assertEquals(100.0, details.getStatistics().getSuccessRatePercent());
    }

    @Test
    void testImmediateJobFailure() throws Exception {
        Job created = service.createJob(request("immediate").payload(Map.of("fail", true)).build());

        Job job = service.getJob(created.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(1, job.getInvocationCount());
        assertEquals("requested failure",
                     service.getJobDetails(created.getId(), null, null).getInvocations().get(0).getError());
    }

    @Test
    void testOnceJobFiresAndRuleIsRemoved() throws Exception {
        Job created = service.createJob(request("once").executeAt("2026-01-15T10:01:00Z").build());
        assertEquals(JobStatus.SCHEDULED, created.getStatus());
        assertNotNull(created.getRuleId());
        assertTrue(ruleEngine.getRule(created.getRuleId()).isPresent());
        assertEquals(Instant.parse("2026-01-15T10:01:00Z"), created.getExecuteAt());

        clock.advance(Duration.ofSeconds(59));
        assertTrue(scheduler.tick().isEmpty());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, scheduler.tick().size());

        Job job = service.getJob(created.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(1, job.getInvocationCount());
        assertFalse(ruleEngine.getRule(created.getRuleId()).isPresent());

        List<Invocation> invocations = service.getJobDetails(created.getId(), null, null).getInvocations();
        assertEquals(1, invocations.size());
        assertEquals(InvocationStatus.COMPLETED, invocations.get(0).getStatus());
    }

    @Test
    void testOnceJobRuleRemovedAfterFailure() throws Exception {
        Job created = service.createJob(request("once").executeAt("2026-01-15T10:00:30Z")
                                          .payload(Map.of("fail", true)).build());

        clock.advance(Duration.ofSeconds(30));
        scheduler.tick();

        assertEquals(JobStatus.FAILED, service.getJob(created.getId()).orElseThrow().getStatus());
        assertTrue(ruleEngine.listRules().isEmpty());
    }

    @Test
    void testRateJobFiresThreeTimes() throws Exception {
        Job created = service.createJob(request("cron").scheduleExpression("rate(15 minutes)").build());
        assertEquals(JobStatus.SCHEDULED, created.getStatus());

        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofMinutes(15));
            assertEquals(1, scheduler.tick().size());
            assertEquals(JobStatus.SCHEDULED, service.getJob(created.getId()).orElseThrow().getStatus());
        }

        Job job = service.getJob(created.getId()).orElseThrow();
        assertEquals(3, job.getInvocationCount());
        assertEquals(Instant.parse("2026-01-15T10:45:00Z"), job.getLastExecutedAt());

        List<Invocation> invocations = scheduler.getLedger().queryByJob(created.getId(), null, 10, true);
        assertEquals(3, invocations.size());
        assertTrue(invocations.get(0).getStartedAt().isAfter(invocations.get(1).getStartedAt()));
        assertTrue(invocations.get(1).getStartedAt().isAfter(invocations.get(2).getStartedAt()));
        assertTrue(ruleEngine.getRule(created.getRuleId()).isPresent());
    }

    @Test
    void testLeapDayCronJobAccepted() throws Exception {
        clock.set(Instant.parse("2026-10-19T08:00:00Z"));

        Job created = service.createJob(request("cron").scheduleExpression("0 0 29 2 *").build());

        assertEquals(JobStatus.SCHEDULED, created.getStatus());
        assertEquals(Instant.parse("2028-02-29T00:00:00Z"),
                     ruleEngine.getRule(created.getRuleId()).orElseThrow().getNextFireAt());
    }

    @Test
    void testUnsatisfiableSchedulesRejected() {
        for (String expression : new String[] {"0 0 31 2 *", "rate(200000000000 days)"}) {
            JobValidationException e = assertThrows(JobValidationException.class,
                () -> service.createJob(request("cron").scheduleExpression(expression).build()), expression);
            assertEquals("scheduleExpression", e.getField());
        }
        assertEquals(0, scheduler.getJobStore().size());
        assertTrue(ruleEngine.listRules().isEmpty());
    }

    @Test
    void testJobDetailsFilters() throws Exception {
        Job created = service.createJob(request("cron").scheduleExpression("*/5 * * * *").build());
        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofMinutes(5));
            scheduler.tick();
        }

        JobDetails limited = service.getJobDetails(created.getId(), 2, null);
        assertEquals(2, limited.getInvocations().size());
        assertEquals(2, limited.getStatistics().getTotal());

        assertEquals(4, service.getJobDetails(created.getId(), null, "completed").getInvocations().size());
        assertTrue(service.getJobDetails(created.getId(), null, "failed").getInvocations().isEmpty());
        assertTrue(service.getJobDetails(created.getId(), null, "bogus").getInvocations().isEmpty());
        assertThrows(JobNotFoundException.class, () -> service.getJobDetails(UUID.randomUUID(), null, null));
    }

    @Test
    void testListJobs() throws Exception {
        Job immediate = service.createJob(request("immediate").build());
        clock.advance(Duration.ofSeconds(1));
        Job once = service.createJob(request("once").executeAt("2026-01-16T00:00:00Z").build());
        clock.advance(Duration.ofSeconds(1));
        Job cron = service.createJob(request("cron").scheduleExpression("0 * * * *").build());

        assertEquals(List.of(cron.getId(), once.getId(), immediate.getId()),
                     ids(service.listJobs(null, null, null)));
        assertEquals(List.of(once.getId()), ids(service.listJobs("once", null, null)));
        assertEquals(List.of(cron.getId(), once.getId()), ids(service.listJobs(null, "scheduled", null)));
        assertEquals(List.of(immediate.getId()), ids(service.listJobs("immediate", "completed", null)));
        assertEquals(List.of(cron.getId()), ids(service.listJobs(null, null, 1)));
        assertTrue(service.listJobs("weekly", null, null).isEmpty());
        assertTrue(service.listJobs(null, "paused", null).isEmpty());
    }

    private static List<UUID> ids(List<Job> jobs) {
        return jobs.stream().map(Job::getId).collect(java.util.stream.Collectors.toList());
    }

    @Test
    void testDeleteRemovesRuleAndKeepsHistory() throws Exception {
        Job created = service.createJob(request("cron").scheduleExpression("rate(5 minutes)").build());
        clock.advance(Duration.ofMinutes(5));
        scheduler.tick();

        Job deleted = service.deleteJob(created.getId());

        assertEquals(created.getId(), deleted.getId());
        assertFalse(service.getJob(created.getId()).isPresent());
        assertTrue(ruleEngine.listRules().isEmpty());
        assertEquals(1, scheduler.getLedger().queryByJob(created.getId(), null, 10, true).size());

        clock.advance(Duration.ofMinutes(5));
        assertTrue(scheduler.tick().isEmpty());
    }

    @Test
    void testDeleteUnknownJob() throws Exception {
        service.createJob(request("cron").scheduleExpression("0 * * * *").build());

        assertThrows(JobNotFoundException.class, () -> service.deleteJob(UUID.randomUUID()));
        assertEquals(1, scheduler.getJobStore().size());
        assertEquals(1, ruleEngine.listRules().size());
    }

    @Test
    void testDeleteOrphanedScheduledJob() throws Exception {
        Job orphan = scheduler.getJobStore().createJob(Job.builder()
            .name("orphan").type(JobType.ONCE).executeAt(clock.instant().plusSeconds(60))
            .createdAt(clock.instant()).build());

        service.deleteJob(orphan.getId());

        assertFalse(service.getJob(orphan.getId()).isPresent());
    }
}
