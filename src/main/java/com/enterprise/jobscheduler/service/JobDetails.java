package com.enterprise.jobscheduler.service;

import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.ledger.InvocationStatistics;

import java.util.List;

/**
 * A job together with its most recent invocations and their statistics
 */
public class JobDetails {

    private final Job job;
    private final List<Invocation> invocations;
    private final InvocationStatistics statistics;

    public JobDetails(Job job, List<Invocation> invocations, InvocationStatistics statistics) {
        this.job = job;
        this.invocations = List.copyOf(invocations);
        this.statistics = statistics;
    }

    public Job getJob() { return job; }

    public List<Invocation> getInvocations() { return invocations; }

    public InvocationStatistics getStatistics() { return statistics; }
}
