package com.enterprise.jobscheduler.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One recorded execution attempt of a job.
 * Created as RUNNING and finalized exactly once as COMPLETED or FAILED.
 */
public class Invocation {

    private final UUID id;
    private final UUID jobId;
    private final long sequence;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long durationMs;
    private final InvocationStatus status;
    private final Map<String, Object> input;
    private final Map<String, Object> output;
    private final String error;
    private final String errorStack;
    private final ErrorKind errorKind;

    @JsonCreator
    public Invocation(@JsonProperty("id") UUID id,
                      @JsonProperty("jobId") UUID jobId,
                      @JsonProperty("sequence") long sequence,
                      @JsonProperty("startedAt") Instant startedAt,
                      @JsonProperty("completedAt") Instant completedAt,
                      @JsonProperty("durationMs") Long durationMs,
                      @JsonProperty("status") InvocationStatus status,
                      @JsonProperty("input") Map<String, Object> input,
                      @JsonProperty("output") Map<String, Object> output,
                      @JsonProperty("error") String error,
                      @JsonProperty("errorStack") String errorStack,
                      @JsonProperty("errorKind") ErrorKind errorKind) {
        this.id = Objects.requireNonNull(id, "Invocation ID cannot be null");
        this.jobId = Objects.requireNonNull(jobId, "Job ID cannot be null");
        this.sequence = sequence;
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.completedAt = completedAt;
        this.durationMs = durationMs;
        this.status = Objects.requireNonNull(status, "Invocation status cannot be null");
        this.input = copyOf(input);
        this.output = output != null ? copyOf(output) : null;
        this.error = error;
        this.errorStack = errorStack;
        this.errorKind = errorKind;
    }

    /**
     * Creates a RUNNING invocation for a job
     */
    public static Invocation running(UUID jobId, Instant startedAt, Map<String, Object> input) {
        return new Invocation(UUID.randomUUID(), jobId, 0, startedAt, null, null,
                              InvocationStatus.RUNNING, input, null, null, null, null);
    }

    /**
     * Creates an invocation that failed before it could be recorded as running
     */
    public static Invocation failedImmediately(UUID jobId, Instant startedAt, Instant completedAt,
                                               Throwable error) {
        return new Invocation(UUID.randomUUID(), jobId, 0, startedAt, completedAt,
                              Duration.between(startedAt, completedAt).toMillis(),
                              InvocationStatus.FAILED, null, null,
                              error.getMessage(), stackTraceOf(error), ErrorKind.DISPATCH);
    }

    public UUID getId() { return id; }

    public UUID getJobId() { return jobId; }

    /**
     * Ledger-assigned order of recording, used to break ties between equal start times
     */
    public long getSequence() { return sequence; }

    public Instant getStartedAt() { return startedAt; }

    public Instant getCompletedAt() { return completedAt; }

    public Long getDurationMs() { return durationMs; }

    public InvocationStatus getStatus() { return status; }

    public Map<String, Object> getInput() { return input; }

    public Map<String, Object> getOutput() { return output; }

    public String getError() { return error; }

    public String getErrorStack() { return errorStack; }

    public ErrorKind getErrorKind() { return errorKind; }

    @JsonIgnore
    public boolean isFinalized() {
        return status != InvocationStatus.RUNNING;
    }

    public Invocation withSequence(long sequence) {
        return new Invocation(id, jobId, sequence, startedAt, completedAt, durationMs, status,
                              input, output, error, errorStack, errorKind);
    }

    /**
     * Finalizes this invocation as COMPLETED
     */
    public Invocation complete(Map<String, Object> output, Instant completedAt) {
        requireRunning();
        return new Invocation(id, jobId, sequence, startedAt, completedAt, durationUntil(completedAt),
                              InvocationStatus.COMPLETED, input, output, null, null, null);
    }

    /**
     * Finalizes this invocation as FAILED
     */
    public Invocation fail(String error, String errorStack, ErrorKind errorKind, Instant completedAt) {
        requireRunning();
        return new Invocation(id, jobId, sequence, startedAt, completedAt, durationUntil(completedAt),
                              InvocationStatus.FAILED, input, null, error, errorStack, errorKind);
    }

    private void requireRunning() {
        if (isFinalized()) {
            throw new IllegalStateException("Invocation " + id + " is already " + status.value());
        }
    }

    private long durationUntil(Instant completedAt) {
        return Math.max(0, Duration.between(startedAt, completedAt).toMillis());
    }

    private static Map<String, Object> copyOf(Map<String, Object> map) {
        return map != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(map))
            : Collections.emptyMap();
    }

    public static String stackTraceOf(Throwable error) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        error.printStackTrace(pw);
        return sw.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Invocation that = (Invocation) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Invocation{" +
                "id=" + id +
                ", jobId=" + jobId +
                ", status=" + status +
                ", startedAt=" + startedAt +
                ", durationMs=" + durationMs +
                ", errorKind=" + errorKind +
                '}';
    }
}
