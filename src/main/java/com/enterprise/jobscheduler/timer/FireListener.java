package com.enterprise.jobscheduler.timer;

/**
 * Receives fire signals from the rule engine's wake loop.
 * Implementations must tolerate the same rule firing more than once.
 */
@FunctionalInterface
public interface FireListener {

    void onFire(FireSignal signal);
}
