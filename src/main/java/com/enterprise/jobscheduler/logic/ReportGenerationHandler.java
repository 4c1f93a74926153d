package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Simulated report generation
 */
public class ReportGenerationHandler extends AbstractActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReportGenerationHandler.class);

    public static final String ACTION = "generate-report";

    private final String reportBaseUrl;
    private final Random random;

    public ReportGenerationHandler(Clock clock, Duration workDelay, String reportBaseUrl) {
        this(clock, workDelay, reportBaseUrl, new Random());
    }

    public ReportGenerationHandler(Clock clock, Duration workDelay, String reportBaseUrl, Random random) {
        super(clock, workDelay);
        this.reportBaseUrl = reportBaseUrl.endsWith("/") ? reportBaseUrl : reportBaseUrl + "/";
        this.random = random;
    }

    @Override
    public Map<String, Object> handle(Job job, Map<String, Object> input) throws JobExecutionException {
        String reportType = stringValue(input, "reportType", "general");
        logger.info("Generating {} report for job {}", reportType, job.getId());

        simulateWork();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Report generated successfully");
        result.put("reportType", reportType);
        result.put("generatedAt", now());
        result.put("reportUrl", reportBaseUrl + job.getId() + ".pdf");
        result.put("recordsIncluded", random.nextInt(1000));
        return result;
    }

    @Override
    public String getSupportedAction() {
        return ACTION;
    }
}
