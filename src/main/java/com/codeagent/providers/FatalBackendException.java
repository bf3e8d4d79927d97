package com.codeagent.providers;

/** Authentication failures, malformed requests, exhausted retries. Never retried. */
public class FatalBackendException extends BackendException {

    public FatalBackendException(String message) {
        this(message, 0, null);
    }

    public FatalBackendException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() { return false; }
}
