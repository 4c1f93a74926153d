package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends a notification to the payload's {@code recipient}. Delivery is logged only.
 */
public class NotificationHandler extends AbstractActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(NotificationHandler.class);

    public static final String ACTION = "send-notification";

    public NotificationHandler(Clock clock) {
        super(clock, Duration.ZERO);
    }

    @Override
    public Map<String, Object> handle(Job job, Map<String, Object> input) {
        String recipient = stringValue(input, "recipient", null);
        String message = stringValue(input, "message", null);

        logger.info("Sending notification for job {} to {}: {}", job.getId(), recipient, message);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Notification sent successfully");
        result.put("recipient", recipient);
        result.put("sentAt", now());
        return result;
    }

    @Override
    public String getSupportedAction() {
        return ACTION;
    }
}
