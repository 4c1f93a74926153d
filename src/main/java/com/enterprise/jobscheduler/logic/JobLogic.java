package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;

import java.util.Map;

/**
 * Execution interface called by the dispatcher for every invocation.
 * Implementations should be thread-safe; the same job may be executed concurrently
 * when a fire is delivered more than once.
 */
@FunctionalInterface
public interface JobLogic {

    /**
     * Execute a job
     * @param job   the job being executed
     * @param input the payload delivered with this invocation
     * @return the invocation output
     * @throws JobExecutionException if the job fails
     */
    Map<String, Object> execute(Job job, Map<String, Object> input) throws JobExecutionException;
}
