package com.enterprise.jobscheduler.timer;

/**
 * Shape of a timer rule
 */
public enum RuleKind {
    ONE_SHOT,    // Fires once at a fixed instant, then is consumed
    RECURRING    // Fires on every match of a schedule expression
}
