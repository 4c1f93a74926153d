package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Simulated cleanup of a {@code target} older than {@code olderThan}
 */
public class CleanupHandler extends AbstractActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CleanupHandler.class);

    public static final String ACTION = "cleanup";

    private final Random random;

    public CleanupHandler(Clock clock) {
        this(clock, new Random());
    }

    public CleanupHandler(Clock clock, Random random) {
        super(clock, Duration.ZERO);
        this.random = random;
    }

    @Override
    public Map<String, Object> handle(Job job, Map<String, Object> input) {
        String target = stringValue(input, "target", "unknown");
        String olderThan = stringValue(input, "olderThan", "30days");

        logger.info("Cleaning up {} older than {} for job {}", target, olderThan, job.getId());
        int recordsDeleted = random.nextInt(100);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Cleanup completed successfully");
        result.put("target", target);
        result.put("olderThan", olderThan);
        result.put("recordsDeleted", recordsDeleted);
        result.put("cleanupDate", now());
        return result;
    }

    @Override
    public String getSupportedAction() {
        return ACTION;
    }
}
