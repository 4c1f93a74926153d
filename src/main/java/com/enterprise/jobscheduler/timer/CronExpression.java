package com.enterprise.jobscheduler.timer;

import com.enterprise.jobscheduler.exception.JobValidationException;
import it.sauronsoftware.cron4j.SchedulingPattern;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minute-granularity cron schedule backed by a cron4j {@link SchedulingPattern}, matched in UTC.
 */
public class CronExpression implements ScheduleExpression {

    static final TimeZone UTC = TimeZone.getTimeZone("UTC");
    /** One full Gregorian cycle; the calendar, weekdays included, repeats after it. */
    static final Duration LOOKAHEAD = Duration.ofDays(146097);

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private final String expression;
    private final String pattern;
    private final SchedulingPattern schedulingPattern;
    private final SchedulingPattern dayPattern;

    CronExpression(String expression, String pattern) {
        this.expression = expression;
        this.pattern = pattern;
        this.schedulingPattern = new SchedulingPattern(pattern);
        this.dayPattern = new SchedulingPattern(dayFieldsOf(pattern));
    }

    /**
     * The same pattern with minute and hour widened to {@code *}, so a day can be tested in one match.
     */
    private static String dayFieldsOf(String pattern) {
        StringBuilder days = new StringBuilder();
        for (String alternative : pattern.split("\\|")) {
            String[] fields = alternative.trim().split("\\s+");
            if (days.length() > 0) {
                days.append('|');
            }
            days.append("* *");
            for (int i = 2; i < fields.length; i++) {
                days.append(' ').append(fields[i]);
            }
        }
        return days.toString();
    }

    static CronExpression parse(String expression) throws JobValidationException {
        String pattern = expression;
        if (expression.toLowerCase(Locale.ROOT).startsWith("cron(")) {
            if (!expression.endsWith(")")) {
                throw new JobValidationException("scheduleExpression", "Invalid cron expression: " + expression);
            }
            pattern = fromCloudFormat(expression, expression.substring(5, expression.length() - 1).trim());
        }

        if (!SchedulingPattern.validate(pattern)) {
            throw new JobValidationException("scheduleExpression", "Invalid cron expression: " + expression);
        }
        return new CronExpression(expression, pattern);
    }

    /**
     * Converts {@code min hour day-of-month month day-of-week year} to a five-field cron4j pattern.
     * Day-of-week numbers run 1-7 from Sunday in the six-field form and 0-6 in cron4j.
     */
    private static String fromCloudFormat(String expression, String body) throws JobValidationException {
        String[] fields = body.split("\\s+");
        if (fields.length != 6) {
            throw new JobValidationException("scheduleExpression",
                "Cron expression must have 6 fields (minutes hours day-of-month month day-of-week year): " + expression);
        }
        if (!"*".equals(fields[5])) {
            throw new JobValidationException("scheduleExpression",
                "Only '*' is supported in the year field: " + expression);
        }
        for (String field : fields) {
            if (field.contains("#") || field.contains("W")) {
                throw new JobValidationException("scheduleExpression",
                    "Unsupported cron field '" + field + "': " + expression);
            }
        }
        if (fields[4].contains("L")) {
            throw new JobValidationException("scheduleExpression",
                "Unsupported day-of-week field '" + fields[4] + "': " + expression);
        }

        String dayOfMonth = "?".equals(fields[2]) ? "*" : fields[2];
        String dayOfWeek = "?".equals(fields[4]) ? "*" : shiftDaysOfWeek(expression, fields[4]);
        return String.join(" ", fields[0], fields[1], dayOfMonth, fields[3], dayOfWeek);
    }

    private static String shiftDaysOfWeek(String expression, String field) throws JobValidationException {
        StringBuilder shifted = new StringBuilder();
        for (String element : field.split(",")) {
            if (shifted.length() > 0) {
                shifted.append(',');
            }
            int slash = element.indexOf('/');
            String range = slash >= 0 ? element.substring(0, slash) : element;
            String step = slash >= 0 ? element.substring(slash) : "";

            Matcher matcher = NUMBER.matcher(range);
            StringBuffer buffer = new StringBuffer();
            while (matcher.find()) {
                int day = Integer.parseInt(matcher.group());
                if (day < 1 || day > 7) {
                    throw new JobValidationException("scheduleExpression",
                        "Day-of-week must be between 1 and 7: " + expression);
                }
                matcher.appendReplacement(buffer, Integer.toString(day - 1));
            }
            matcher.appendTail(buffer);
            shifted.append(buffer).append(step);
        }
        return shifted.toString();
    }

    @Override
    public String getExpression() {
        return expression;
    }

    /**
     * The five-field pattern handed to cron4j
     */
    public String getPattern() {
        return pattern;
    }

    @Override
    public Instant nextFireAfter(Instant after, Instant anchor) {
        Instant candidate = after.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        Instant limit = after.plus(LOOKAHEAD);
        while (!candidate.isAfter(limit)) {
            Instant nextDay = candidate.truncatedTo(ChronoUnit.DAYS).plus(1, ChronoUnit.DAYS);
            if (dayPattern.match(UTC, candidate.toEpochMilli())) {
                for (Instant minute = candidate; minute.isBefore(nextDay); minute = minute.plus(1, ChronoUnit.MINUTES)) {
                    if (schedulingPattern.match(UTC, minute.toEpochMilli())) {
                        return minute;
                    }
                }
            }
            candidate = nextDay;
        }
        return null;
    }

    @Override
    public String toString() {
        return "CronExpression{" + expression + " -> " + pattern + '}';
    }
}
