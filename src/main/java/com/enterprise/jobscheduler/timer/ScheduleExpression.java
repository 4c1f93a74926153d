package com.enterprise.jobscheduler.timer;

import com.enterprise.jobscheduler.exception.JobValidationException;

import java.time.Instant;
import java.util.Locale;

/**
 * Recurring schedule evaluated in UTC.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>five-field Unix cron, e.g. {@code 0 12 * * 1-5}</li>
 *   <li>cloud-scheduler cron, e.g. {@code cron(0 12 ? * MON-FRI *)}</li>
 *   <li>fixed rate, e.g. {@code rate(15 minutes)}</li>
 * </ul>
 */
public interface ScheduleExpression {

    /**
     * The expression as originally written
     */
    String getExpression();

    /**
     * First fire time strictly after {@code after}, or null if the schedule can never fire.
     *
     * @param after  lower bound, exclusive
     * @param anchor registration time; rate expressions count their intervals from here
     */
    Instant nextFireAfter(Instant after, Instant anchor);

    /**
     * Parse an expression in any of the accepted forms
     *
     * @throws JobValidationException if the expression is empty or malformed
     */
    static ScheduleExpression parse(String expression) throws JobValidationException {
        if (expression == null || expression.trim().isEmpty()) {
            throw new JobValidationException("scheduleExpression", "scheduleExpression is required for cron type jobs");
        }
        String trimmed = expression.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("rate(")) {
            return RateExpression.parse(trimmed);
        }
        return CronExpression.parse(trimmed);
    }
}
