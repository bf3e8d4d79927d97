package com.codeagent.providers;

import java.time.Duration;
import java.util.Optional;

/** Timeouts, rate limiting, 5xx-class failures. Retried with backoff. */
public class TransientBackendException extends BackendException {

    private final Duration retryAfter;

    public TransientBackendException(String message) {
        this(message, 0, null, null);
    }

    public TransientBackendException(String message, int statusCode, Duration retryAfter, Throwable cause) {
        super(message, statusCode, cause);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() { return true; }
}
