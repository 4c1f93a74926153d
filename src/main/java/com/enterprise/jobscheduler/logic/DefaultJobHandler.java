package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback for payloads without a registered action; echoes the payload back.
 */
public class DefaultJobHandler extends AbstractActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultJobHandler.class);

    public static final String ACTION = "default";

    public DefaultJobHandler(Clock clock, Duration workDelay) {
        super(clock, workDelay);
    }

    @Override
    public Map<String, Object> handle(Job job, Map<String, Object> input) throws JobExecutionException {
        logger.info("Executing default job logic for job {} ({})", job.getId(), job.getName());

        simulateWork();

        Map<String, Object> customData = new LinkedHashMap<>();
        customData.put("processingTimeMs", workDelay.toMillis());
        customData.put("status", "success");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Job completed successfully");
        result.put("executedAt", now());
        result.put("jobName", job.getName());
        result.put("payload", input);
        result.put("customData", customData);
        return result;
    }

    @Override
    public String getSupportedAction() {
        return ACTION;
    }
}
