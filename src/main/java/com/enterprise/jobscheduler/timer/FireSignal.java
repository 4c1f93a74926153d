package com.enterprise.jobscheduler.timer;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One emission of a due rule
 */
public class FireSignal {

    private final String ruleId;
    private final UUID jobId;
    private final RuleKind kind;
    private final Instant scheduledFor;
    private final Instant firedAt;
    private final Map<String, Object> input;

    public FireSignal(String ruleId, UUID jobId, RuleKind kind, Instant scheduledFor,
                      Instant firedAt, Map<String, Object> input) {
        this.ruleId = ruleId;
        this.jobId = jobId;
        this.kind = kind;
        this.scheduledFor = scheduledFor;
        this.firedAt = firedAt;
        this.input = input;
    }

    static FireSignal of(Rule rule, Instant firedAt) {
        return new FireSignal(rule.getId(), rule.getJobId(), rule.getKind(), rule.getNextFireAt(),
                              firedAt, rule.getInput());
    }

    public String getRuleId() { return ruleId; }

    public UUID getJobId() { return jobId; }

    public RuleKind getKind() { return kind; }

    /**
     * When the rule was due; may be earlier than the fire time after downtime
     */
    public Instant getScheduledFor() { return scheduledFor; }

    public Instant getFiredAt() { return firedAt; }

    public Map<String, Object> getInput() { return input; }

    @Override
    public String toString() {
        return "FireSignal{ruleId='" + ruleId + "', jobId=" + jobId +
               ", scheduledFor=" + scheduledFor + ", firedAt=" + firedAt + '}';
    }
}
