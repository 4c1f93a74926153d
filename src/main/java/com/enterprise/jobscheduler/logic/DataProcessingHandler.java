package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Marks every item of the payload's {@code data} list as processed
 */
public class DataProcessingHandler extends AbstractActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(DataProcessingHandler.class);

    public static final String ACTION = "process-data";

    public DataProcessingHandler(Clock clock) {
        super(clock, Duration.ZERO);
    }

    @Override
    public Map<String, Object> handle(Job job, Map<String, Object> input) throws JobExecutionException {
        Object data = input.get("data");
        if (data != null && !(data instanceof List)) {
            throw new JobExecutionException("Field 'data' must be a list, got " + data.getClass().getSimpleName());
        }

        List<?> items = data != null ? (List<?>) data : List.of();
        logger.info("Processing {} items for job {}", items.size(), job.getId());

        String processedAt = now();
        List<Map<String, Object>> processed = new ArrayList<>(items.size());
        for (Object item : items) {
            processed.add(markProcessed(item, processedAt, job));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Data processed successfully");
        result.put("itemsProcessed", processed.size());
        result.put("data", processed);
        return result;
    }

    private Map<String, Object> markProcessed(Object item, String processedAt, Job job) {
        Map<String, Object> record = new LinkedHashMap<>();
        if (item instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) item).entrySet()) {
                record.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else if (item != null) {
            record.put("value", item);
        }
        record.put("processed", true);
        record.put("processedAt", processedAt);
        record.put("processedBy", job.getId().toString());
        return record;
    }

    @Override
    public String getSupportedAction() {
        return ACTION;
    }
}
