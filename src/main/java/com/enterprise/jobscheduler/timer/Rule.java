package com.enterprise.jobscheduler.timer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable schedule entry owned by a job.
 */
public class Rule {

    private final String id;
    private final UUID jobId;
    private final RuleKind kind;
    private final Instant fireAt;
    private final String expression;
    private final boolean enabled;
    private final Map<String, Object> input;
    private final Instant nextFireAt;
    private final Instant createdAt;

    @JsonCreator
    public Rule(@JsonProperty("id") String id,
                @JsonProperty("jobId") UUID jobId,
                @JsonProperty("kind") RuleKind kind,
                @JsonProperty("fireAt") Instant fireAt,
                @JsonProperty("expression") String expression,
                @JsonProperty("enabled") boolean enabled,
                @JsonProperty("input") Map<String, Object> input,
                @JsonProperty("nextFireAt") Instant nextFireAt,
                @JsonProperty("createdAt") Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Rule ID cannot be null");
        this.jobId = Objects.requireNonNull(jobId, "Job ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Rule kind cannot be null");
        this.fireAt = fireAt;
        this.expression = expression;
        this.enabled = enabled;
        this.input = input != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(input))
            : Collections.emptyMap();
        this.nextFireAt = nextFireAt;
        this.createdAt = createdAt;
    }

    /**
     * Rule names follow the job they belong to, so re-registering a job replaces its rule
     */
    public static String idFor(UUID jobId) {
        return "job-" + jobId;
    }

    public static Rule oneShot(UUID jobId, Instant fireAt, Map<String, Object> input, Instant now) {
        return new Rule(idFor(jobId), jobId, RuleKind.ONE_SHOT, fireAt, null, true, input, fireAt, now);
    }

    public static Rule recurring(UUID jobId, String expression, Map<String, Object> input,
                                 Instant firstFireAt, Instant now) {
        return new Rule(idFor(jobId), jobId, RuleKind.RECURRING, null, expression, true, input,
                        firstFireAt, now);
    }

    public String getId() { return id; }

    public UUID getJobId() { return jobId; }

    public RuleKind getKind() { return kind; }

    /**
     * Fire instant of a one-shot rule
     */
    public Instant getFireAt() { return fireAt; }

    /**
     * Schedule expression of a recurring rule
     */
    public String getExpression() { return expression; }

    public boolean isEnabled() { return enabled; }

    /**
     * Payload delivered to the dispatcher with every fire
     */
    public Map<String, Object> getInput() { return input; }

    public Instant getNextFireAt() { return nextFireAt; }

    public Instant getCreatedAt() { return createdAt; }

    public boolean isDue(Instant now) {
        return enabled && nextFireAt != null && !nextFireAt.isAfter(now);
    }

    public Rule withNextFireAt(Instant nextFireAt) {
        return new Rule(id, jobId, kind, fireAt, expression, enabled, input, nextFireAt, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rule rule = (Rule) o;
        return Objects.equals(id, rule.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Rule{" +
                "id='" + id + '\'' +
                ", jobId=" + jobId +
                ", kind=" + kind +
                ", expression='" + expression + '\'' +
                ", nextFireAt=" + nextFireAt +
                ", enabled=" + enabled +
                '}';
    }
}
