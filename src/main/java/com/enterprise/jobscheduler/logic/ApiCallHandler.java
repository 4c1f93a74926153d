package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Simulated call to an external endpoint
 */
public class ApiCallHandler extends AbstractActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiCallHandler.class);

    public static final String ACTION = "api-call";

    public ApiCallHandler(Clock clock, Duration workDelay) {
        super(clock, workDelay);
    }

    @Override
    public Map<String, Object> handle(Job job, Map<String, Object> input) throws JobExecutionException {
        String endpoint = stringValue(input, "endpoint", null);
        String method = stringValue(input, "method", "GET").toUpperCase(Locale.ROOT);

        logger.info("{} {} for job {}", method, endpoint, job.getId());

        long start = System.nanoTime();
        simulateWork();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "API call completed successfully");
        result.put("endpoint", endpoint);
        result.put("method", method);
        result.put("status", 200);
        result.put("responseTimeMs", elapsedMs);
        return result;
    }

    @Override
    public String getSupportedAction() {
        return ACTION;
    }
}
