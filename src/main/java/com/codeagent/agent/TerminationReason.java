package com.codeagent.agent;

public enum TerminationReason {
    /** The model invoked the terminal tool. */
    SUBMITTED("submitted"),
    /** Tool-call count or wall time ran out before submission. */
    BUDGET_EXCEEDED("budget_exceeded"),
    /** Non-retryable backend failure, or retries exhausted. */
    BACKEND_ERROR("backend_error"),
    /** Patch-only mode: the first text reply is the artifact. */
    COMPLETED("completed");

    private final String code;

    TerminationReason(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
