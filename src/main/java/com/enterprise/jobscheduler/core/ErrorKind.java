package com.enterprise.jobscheduler.core;

/**
 * Why a failed invocation failed
 */
public enum ErrorKind {
    EXECUTION,   // Job logic threw or reported an error
    TIMEOUT,     // Job logic exceeded the execution timeout
    DISPATCH     // Bookkeeping around the call failed unexpectedly
}
