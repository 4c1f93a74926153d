package com.enterprise.jobscheduler.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unvalidated job submission as received from a client.
 * Type and execution time are kept as raw strings; {@link JobService} validates them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobRequest {

    private final String name;
    private final String description;
    private final String type;
    private final String scheduleExpression;
    private final String executeAt;
    private final Map<String, Object> payload;

    @JsonCreator
    public JobRequest(@JsonProperty("name") String name,
                      @JsonProperty("description") String description,
                      @JsonProperty("type") String type,
                      @JsonProperty("scheduleExpression") String scheduleExpression,
                      @JsonProperty("executeAt") String executeAt,
                      @JsonProperty("payload") Map<String, Object> payload) {
        this.name = name;
        this.description = description;
        this.type = type;
        this.scheduleExpression = scheduleExpression;
        this.executeAt = executeAt;
        this.payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
            : Collections.emptyMap();
    }

    public String getName() { return name; }

    public String getDescription() { return description; }

    public String getType() { return type; }

    public String getScheduleExpression() { return scheduleExpression; }

    public String getExecuteAt() { return executeAt; }

    public Map<String, Object> getPayload() { return payload; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private String type;
        private String scheduleExpression;
        private String executeAt;
        private Map<String, Object> payload;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder scheduleExpression(String scheduleExpression) {
            this.scheduleExpression = scheduleExpression;
            return this;
        }

        public Builder executeAt(String executeAt) {
            this.executeAt = executeAt;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public JobRequest build() {
            return new JobRequest(name, description, type, scheduleExpression, executeAt, payload);
        }
    }
}
