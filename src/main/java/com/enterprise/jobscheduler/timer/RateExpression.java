package com.enterprise.jobscheduler.timer;

import com.enterprise.jobscheduler.exception.JobValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-interval schedule, {@code rate(<value> <unit>)}.
 * Fires at anchor + k * interval for k >= 1.
 */
public class RateExpression implements ScheduleExpression {

    private static final Pattern RATE = Pattern.compile(
        "rate\\(\\s*(\\d+)\\s+(minute|minutes|hour|hours|day|days)\\s*\\)", Pattern.CASE_INSENSITIVE);

    static final Duration MAX_INTERVAL = Duration.ofDays(146097);

    private final String expression;
    private final Duration interval;

    RateExpression(String expression, Duration interval) {
        this.expression = expression;
        this.interval = interval;
    }

    static RateExpression parse(String expression) throws JobValidationException {
        Matcher matcher = RATE.matcher(expression);
        if (!matcher.matches()) {
            throw new JobValidationException("scheduleExpression", "Invalid rate expression: " + expression);
        }

        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new JobValidationException("scheduleExpression", "Invalid rate value: " + expression, e);
        }
        if (value <= 0) {
            throw new JobValidationException("scheduleExpression", "Rate value must be greater than 0: " + expression);
        }

        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        Duration interval;
        try {
            if (unit.startsWith("minute")) {
                interval = Duration.ofMinutes(value);
            } else if (unit.startsWith("hour")) {
                interval = Duration.ofHours(value);
            } else {
                interval = Duration.ofDays(value);
            }
        } catch (ArithmeticException e) {
            throw new JobValidationException("scheduleExpression", "Rate value is too large: " + expression, e);
        }
        if (interval.compareTo(MAX_INTERVAL) > 0) {
            throw new JobValidationException("scheduleExpression",
                "Rate interval must not exceed " + MAX_INTERVAL.toDays() + " days: " + expression);
        }
        return new RateExpression(expression, interval);
    }

    @Override
    public String getExpression() {
        return expression;
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public Instant nextFireAfter(Instant after, Instant anchor) {
        if (after.isBefore(anchor)) {
            return anchor.plus(interval);
        }
        long elapsedMs = Duration.between(anchor, after).toMillis();
        long periods = elapsedMs / interval.toMillis() + 1;
        return anchor.plus(interval.multipliedBy(periods));
    }

    @Override
    public String toString() {
        return "RateExpression{" + expression + '}';
    }
}
