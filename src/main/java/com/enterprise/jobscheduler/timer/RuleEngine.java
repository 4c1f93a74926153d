package com.enterprise.jobscheduler.timer;

import com.enterprise.jobscheduler.exception.JobValidationException;
import com.enterprise.jobscheduler.exception.SchedulingException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable timer rules with a wake loop that fires each due rule at least once.
 */
public interface RuleEngine {

    /**
     * Registers a rule that fires once at the given instant.
     *
     * @param jobId the owning job
     * @param at    fire time, must be strictly in the future
     * @param input payload delivered with the fire
     * @return the rule ID
     * @throws SchedulingException if {@code at} is not in the future or the rule cannot be stored
     */
    String registerOneShot(UUID jobId, Instant at, Map<String, Object> input) throws SchedulingException;

    /**
     * Registers a rule that fires on every match of a cron or rate expression.
     *
     * @param jobId      the owning job
     * @param expression cron or rate expression, evaluated in UTC
     * @param input      payload delivered with every fire
     * @return the rule ID
     * @throws JobValidationException if the expression is malformed or never fires
     * @throws SchedulingException    if the rule cannot be stored
     */
    String registerRecurring(UUID jobId, String expression, Map<String, Object> input)
        throws JobValidationException, SchedulingException;

    /**
     * Removes a rule. Removing an absent rule is a no-op.
     *
     * @throws SchedulingException if the removal cannot be stored
     */
    void unregister(String ruleId) throws SchedulingException;

    Optional<Rule> getRule(String ruleId);

    List<Rule> listRules();

    /**
     * Runs one tick of the wake loop: emits a signal for every rule due at or before now.
     * One-shot rules are removed and recurring rules advanced before their signals are delivered.
     *
     * @return the signals emitted by this tick
     */
    List<FireSignal> fireDueRules();

    void setFireListener(FireListener listener);

    /**
     * Starts the background wake loop
     */
    void start();

    /**
     * Stops the background wake loop. Stored rules are kept.
     */
    void stop();

    boolean isRunning();

    /**
     * Releases the underlying storage
     */
    void close();
}
