package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;

import java.util.Map;

/**
 * Handles one {@code action} value of a job payload.
 */
public interface ActionHandler {

    /**
     * Handle an invocation routed to this action
     * @param job   the job being executed
     * @param input the invocation payload
     * @return the invocation output
     */
    Map<String, Object> handle(Job job, Map<String, Object> input) throws JobExecutionException;

    /**
     * Get the action this handler supports
     */
    String getSupportedAction();
}
