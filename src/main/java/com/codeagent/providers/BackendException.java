package com.codeagent.providers;

/** Base of the two failure kinds a backend may raise. */
public abstract class BackendException extends RuntimeException {

    private final int statusCode;

    protected BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int statusCode() { return statusCode; }

    public abstract boolean isRetryable();
}
