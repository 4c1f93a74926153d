package com.enterprise.jobscheduler.ledger;

import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Statistics over a window of a job's invocations.
 */
public class InvocationStatistics {

    private final int total;
    private final int completed;
    private final int failed;
    private final int running;
    private final long averageDurationMs;
    private final double successRatePercent;

    @JsonCreator
    public InvocationStatistics(@JsonProperty("total") int total,
                                @JsonProperty("completed") int completed,
                                @JsonProperty("failed") int failed,
                                @JsonProperty("running") int running,
                                @JsonProperty("averageDurationMs") long averageDurationMs,
                                @JsonProperty("successRatePercent") double successRatePercent) {
        this.total = total;
        this.completed = completed;
        this.failed = failed;
        this.running = running;
        this.averageDurationMs = averageDurationMs;
        this.successRatePercent = successRatePercent;
    }

    /**
     * Reduces a window of invocations.
     * The average covers completed invocations only; the success rate is completed / total,
     * as a percentage rounded to two decimals.
     */
    public static InvocationStatistics of(List<Invocation> invocations) {
        int completed = 0;
        int failed = 0;
        int running = 0;
        long completedDurationMs = 0;

        for (Invocation invocation : invocations) {
            if (invocation.getStatus() == InvocationStatus.COMPLETED) {
                completed++;
                completedDurationMs += invocation.getDurationMs() != null ? invocation.getDurationMs() : 0;
            } else if (invocation.getStatus() == InvocationStatus.FAILED) {
                failed++;
            } else {
                running++;
            }
        }

        int total = invocations.size();
        long averageDurationMs = completed > 0 ? Math.round((double) completedDurationMs / completed) : 0;
        double successRatePercent = total > 0
            ? BigDecimal.valueOf(completed * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue()
            : 0.0;

        return new InvocationStatistics(total, completed, failed, running, averageDurationMs, successRatePercent);
    }

    public int getTotal() { return total; }

    public int getCompleted() { return completed; }

    public int getFailed() { return failed; }

    public int getRunning() { return running; }

    public long getAverageDurationMs() { return averageDurationMs; }

    public double getSuccessRatePercent() { return successRatePercent; }

    @Override
    public String toString() {
        return "InvocationStatistics{" +
                "total=" + total +
                ", completed=" + completed +
                ", failed=" + failed +
                ", running=" + running +
                ", averageDurationMs=" + averageDurationMs +
                ", successRatePercent=" + successRatePercent +
                '}';
    }
}
