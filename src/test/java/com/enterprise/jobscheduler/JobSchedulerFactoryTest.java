package com.enterprise.jobscheduler;

import com.enterprise.jobscheduler.config.SchedulerConfig;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.logic.ActionRouter;
import com.enterprise.jobscheduler.monitoring.HealthChecker;
import com.enterprise.jobscheduler.service.JobRequest;
import com.enterprise.jobscheduler.support.MutableClock;
import com.enterprise.jobscheduler.support.TestConfigs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreateWithCustomConfig() {
        try (JobScheduler scheduler = JobSchedulerFactory.create(TestConfigs.deterministic(tempDir))) {
            assertNotNull(scheduler.getJobStore());
            assertNotNull(scheduler.getRuleEngine());
            assertNotNull(scheduler.getLedger());
            assertNotNull(scheduler.getDispatcher());
            assertNotNull(scheduler.getJobService());
            assertNotNull(scheduler.getJobApi());
            assertTrue(scheduler.getHealthChecker().isPresent());
            assertFalse(scheduler.getDispatcher().isAsyncDispatch());

            assertTrue(Files.exists(tempDir.resolve(SchedulerConfig.StorageConfig.JOBS_DB)));
            assertTrue(Files.exists(tempDir.resolve(SchedulerConfig.StorageConfig.RULES_DB)));
            assertTrue(Files.exists(tempDir.resolve(SchedulerConfig.StorageConfig.INVOCATIONS_DB)));
        }
    }

    @Test
    void testInvalidConfigRejected() {
        SchedulerConfig config = SchedulerConfig.builder()
            .dataDirectory(tempDir.toString())
            .executorConfig(new SchedulerConfig.ExecutorConfig(0, 4, Duration.ofSeconds(1), 10, Duration.ofSeconds(1)))
            .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> JobSchedulerFactory.create(config));
        assertTrue(e.getMessage().contains("executor.corePoolSize"));
    }

    @Test
    void testBuiltInActionsUsedByDefault() throws Exception {
        MutableClock clock = MutableClock.at("2026-01-15T10:00:00Z");
        try (JobScheduler scheduler = JobSchedulerFactory.create(TestConfigs.deterministic(tempDir), clock)) {
            Job job = scheduler.getJobService().createJob(JobRequest.builder()
                .name("notify").type("immediate")
                .payload(Map.of(ActionRouter.ACTION_FIELD, "send-notification", "recipient", "team@example.com"))
                .build());

            Map<String, Object> output = scheduler.getLedger()
                .queryByJob(job.getId(), null, 1, true).get(0).getOutput();
            assertEquals("Notification sent successfully", output.get("message"));
            assertEquals("team@example.com", output.get("recipient"));
        }
    }

    @Test
    void testStateSurvivesRestart() throws Exception {
        MutableClock clock = MutableClock.at("2026-01-15T10:00:00Z");
        UUID jobId;
        try (JobScheduler scheduler = JobSchedulerFactory.create(TestConfigs.deterministic(tempDir), clock)) {
            jobId = scheduler.getJobService().createJob(JobRequest.builder()
                .name("later").type("once").executeAt("2026-01-15T12:00:00Z").build()).getId();
        }

        clock.set(java.time.Instant.parse("2026-01-15T12:30:00Z"));
        try (JobScheduler scheduler = JobSchedulerFactory.create(TestConfigs.deterministic(tempDir), clock)) {
            assertEquals(1, scheduler.tick().size());
            assertEquals(JobStatus.COMPLETED,
                         scheduler.getJobService().getJob(jobId).orElseThrow().getStatus());
        }
    }

    @Test
    void testStartStopAndClose() {
        SchedulerConfig config = SchedulerConfig.builder()
            .dataDirectory(tempDir.toString())
            .build();
        JobScheduler scheduler = JobSchedulerFactory.create(config);

        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.getRuleEngine().isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        assertFalse(scheduler.getRuleEngine().isRunning());

        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.close();
        assertFalse(scheduler.isRunning());
        assertFalse(scheduler.getExecutor().isRunning());
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void testHealthCheck() throws Exception {
        try (JobScheduler scheduler = JobSchedulerFactory.create(TestConfigs.deterministic(tempDir))) {
            HealthChecker.HealthStatus status = scheduler.getHealthChecker().orElseThrow()
                .performHealthCheck().get();

            assertTrue(status.getChecks().containsKey("store.jobs"));
            assertTrue(status.getChecks().containsKey("executor.running"));
            // Wake loop disabled, so its running check is skipped
            assertFalse(status.getChecks().containsKey("timer.running"));
            assertTrue(status.getChecks().get("executor.running").isPassed());
        }
    }

    @Test
    void testHealthChecksDisabled() {
        SchedulerConfig base = TestConfigs.deterministic(tempDir);
        SchedulerConfig config = SchedulerConfig.builder()
            .executorConfig(base.getExecutorConfig())
            .storageConfig(base.getStorageConfig())
            .timerConfig(base.getTimerConfig())
            .dispatchConfig(base.getDispatchConfig())
            .monitoringConfig(new SchedulerConfig.MonitoringConfig(false, false, Duration.ZERO))
            .build();

        try (JobScheduler scheduler = JobSchedulerFactory.create(config)) {
            assertFalse(scheduler.getHealthChecker().isPresent());
        }
    }
}
