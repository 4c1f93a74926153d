package com.enterprise.jobscheduler.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of schedulable work with a type-specific trigger policy.
 * Jobs are immutable; status changes produce a new instance.
 */
public class Job {

    private final UUID id;
    private final String name;
    private final String description;
    private final JobType type;
    private final String scheduleExpression;
    private final Instant executeAt;
    private final Map<String, Object> payload;
    private final JobStatus status;
    private final String ruleId;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastExecutedAt;
    private final long invocationCount;

    @JsonCreator
    public Job(@JsonProperty("id") UUID id,
               @JsonProperty("name") String name,
               @JsonProperty("description") String description,
               @JsonProperty("type") JobType type,
               @JsonProperty("scheduleExpression") String scheduleExpression,
               @JsonProperty("executeAt") Instant executeAt,
               @JsonProperty("payload") Map<String, Object> payload,
               @JsonProperty("status") JobStatus status,
               @JsonProperty("ruleId") String ruleId,
               @JsonProperty("createdAt") Instant createdAt,
               @JsonProperty("updatedAt") Instant updatedAt,
               @JsonProperty("lastExecutedAt") Instant lastExecutedAt,
               @JsonProperty("invocationCount") long invocationCount) {
        this.id = Objects.requireNonNull(id, "Job ID cannot be null");
        this.name = name;
        this.description = description != null ? description : "";
        this.type = Objects.requireNonNull(type, "Job type cannot be null");
        this.scheduleExpression = scheduleExpression;
        this.executeAt = executeAt;
        this.payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
            : Collections.emptyMap();
        this.status = Objects.requireNonNull(status, "Job status cannot be null");
        this.ruleId = ruleId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.lastExecutedAt = lastExecutedAt;
        this.invocationCount = invocationCount;
    }

    public UUID getId() { return id; }

    public String getName() { return name; }

    public String getDescription() { return description; }

    public JobType getType() { return type; }

    /**
     * Cron or rate expression, present only for cron jobs
     */
    public String getScheduleExpression() { return scheduleExpression; }

    /**
     * Fire time, present only for once jobs
     */
    public Instant getExecuteAt() { return executeAt; }

    public Map<String, Object> getPayload() { return payload; }

    public JobStatus getStatus() { return status; }

    /**
     * Back-reference to the registered timer rule, null until registration succeeds
     */
    public String getRuleId() { return ruleId; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }

    public Instant getLastExecutedAt() { return lastExecutedAt; }

    public long getInvocationCount() { return invocationCount; }

    public Job withRuleId(String ruleId, Instant updatedAt) {
        return toBuilder().ruleId(ruleId).updatedAt(updatedAt).build();
    }

    /**
     * Applies a status update: new status, counter increment and execution timestamps
     */
    public Job apply(JobStatusUpdate update) {
        Builder builder = toBuilder()
            .invocationCount(invocationCount + update.getInvocationIncrement());
        if (update.getStatus() != null) {
            builder.status(update.getStatus());
        }
        if (update.getLastExecutedAt() != null) {
            builder.lastExecutedAt(update.getLastExecutedAt());
        }
        if (update.getUpdatedAt() != null) {
            builder.updatedAt(update.getUpdatedAt());
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .description(description)
            .type(type)
            .scheduleExpression(scheduleExpression)
            .executeAt(executeAt)
            .payload(payload)
            .status(status)
            .ruleId(ruleId)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .lastExecutedAt(lastExecutedAt)
            .invocationCount(invocationCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", status=" + status +
                ", ruleId='" + ruleId + '\'' +
                ", invocationCount=" + invocationCount +
                '}';
    }

    /**
     * Builder for creating Job instances
     */
    public static class Builder {
        private UUID id = UUID.randomUUID();
        private String name;
        private String description = "";
        private JobType type;
        private String scheduleExpression;
        private Instant executeAt;
        private Map<String, Object> payload;
        private JobStatus status;
        private String ruleId;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastExecutedAt;
        private long invocationCount = 0;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder scheduleExpression(String scheduleExpression) {
            this.scheduleExpression = scheduleExpression;
            return this;
        }

        public Builder executeAt(Instant executeAt) {
            this.executeAt = executeAt;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastExecutedAt(Instant lastExecutedAt) {
            this.lastExecutedAt = lastExecutedAt;
            return this;
        }

        public Builder invocationCount(long invocationCount) {
            this.invocationCount = invocationCount;
            return this;
        }

        public Job build() {
            if (type == null) {
                throw new IllegalArgumentException("Job type is required");
            }
            if (type == JobType.CRON && scheduleExpression == null) {
                throw new IllegalArgumentException("Cron jobs require a schedule expression");
            }
            if (type == JobType.ONCE && executeAt == null) {
                throw new IllegalArgumentException("Once jobs require an execution time");
            }
            if (type != JobType.CRON) {
                scheduleExpression = null;
            }
            if (type != JobType.ONCE) {
                executeAt = null;
            }
            if (status == null) {
                status = type == JobType.IMMEDIATE ? JobStatus.EXECUTING : JobStatus.SCHEDULED;
            }
            return new Job(id, name, description, type, scheduleExpression, executeAt, payload,
                           status, ruleId, createdAt, updatedAt, lastExecutedAt, invocationCount);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
