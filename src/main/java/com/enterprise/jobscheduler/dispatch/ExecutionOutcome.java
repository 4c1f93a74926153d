package com.enterprise.jobscheduler.dispatch;

import com.enterprise.jobscheduler.core.ErrorKind;

import java.util.Map;

/**
 * Result of one bounded call into job logic
 */
public interface ExecutionOutcome {

    /**
     * Whether the job logic returned normally
     */
    boolean isSuccess();

    /**
     * Error message if execution failed
     */
    String getErrorMessage();

    /**
     * Exception that caused the failure (if any)
     */
    Throwable getException();

    /**
     * Why execution failed, null on success
     */
    ErrorKind getErrorKind();

    /**
     * Output of a successful execution
     */
    Map<String, Object> getOutput();

    /**
     * Execution duration in milliseconds
     */
    long getExecutionDurationMs();

    static ExecutionOutcome success(Map<String, Object> output, long executionDurationMs) {
        return new ExecutionOutcomeImpl(true, null, null, null,
                                        output != null ? output : Map.of(), executionDurationMs);
    }

    static ExecutionOutcome failure(String errorMessage, Throwable exception, ErrorKind errorKind,
                                    long executionDurationMs) {
        return new ExecutionOutcomeImpl(false, errorMessage, exception, errorKind, null, executionDurationMs);
    }

    /**
     * Default implementation of ExecutionOutcome
     */
    class ExecutionOutcomeImpl implements ExecutionOutcome {
        private final boolean success;
        private final String errorMessage;
        private final Throwable exception;
        private final ErrorKind errorKind;
        private final Map<String, Object> output;
        private final long executionDurationMs;

        ExecutionOutcomeImpl(boolean success, String errorMessage, Throwable exception, ErrorKind errorKind,
                             Map<String, Object> output, long executionDurationMs) {
            this.success = success;
            this.errorMessage = errorMessage;
            this.exception = exception;
            this.errorKind = errorKind;
            this.output = output;
            this.executionDurationMs = executionDurationMs;
        }

        @Override
        public boolean isSuccess() { return success; }

        @Override
        public String getErrorMessage() { return errorMessage; }

        @Override
        public Throwable getException() { return exception; }

        @Override
        public ErrorKind getErrorKind() { return errorKind; }

        @Override
        public Map<String, Object> getOutput() { return output; }

        @Override
        public long getExecutionDurationMs() { return executionDurationMs; }
    }
}
