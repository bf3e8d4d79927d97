package com.codeagent.providers;

import com.codeagent.shared.config.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Capped exponential backoff around a backend call. Only
 * {@link TransientBackendException} is retried; anything else propagates
 * on the first occurrence.
 */
public class RetryPolicy {

    /** Observes each scheduled retry. */
    @FunctionalInterface
    public interface Listener {
        Listener NONE = (attempt, delay, error) -> { };

        void onRetry(int attempt, Duration delay, TransientBackendException error);
    }

    private final RetryConfig config;
    private final Sleeper sleeper;
    private final Listener listener;

    public RetryPolicy(RetryConfig config) {
        this(config, Sleeper.SYSTEM, Listener.NONE);
    }

    public RetryPolicy(RetryConfig config, Sleeper sleeper, Listener listener) {
        this.config = config;
        this.sleeper = sleeper;
        this.listener = listener;
    }

    public <T> T execute(Supplier<T> action) {
        TransientBackendException last = null;
        int attempts = config.maxRetries() + 1;

        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return action.get();
            } catch (TransientBackendException e) {
                last = e;
                if (attempt < config.maxRetries()) {
                    var wait = delayFor(attempt, e);
                    listener.onRetry(attempt + 1, wait, e);
                    sleep(wait);
                }
            }
        }
        throw new FatalBackendException(
                "Backend call failed after " + attempts + " attempts: " + last.getMessage(),
                last.statusCode(), last);
    }

    /** Base delay for the given 0-based attempt: {@code min(max, initial * 2^attempt)}. */
    public Duration baseDelay(int attempt) {
        long initial = config.initialDelayMs();
        long max = config.maxDelayMs();
        long delay = initial;
        for (int i = 0; i < attempt && delay < max; i++) {
            delay = delay > max / 2 ? max : delay * 2;
        }
        return Duration.ofMillis(Math.min(delay, max));
    }

    Duration delayFor(int attempt, TransientBackendException error) {
        long wait = baseDelay(attempt).toMillis();
        var retryAfter = error.retryAfter();
        if (retryAfter.isPresent()) {
            wait = Math.max(wait, Math.min(retryAfter.get().toMillis(), config.maxDelayMs()));
        }
        if (config.jitterRatio() > 0 && wait > 0) {
            long jitterMax = Math.min(1000, (long) (wait * config.jitterRatio()));
            if (jitterMax > 0 && wait <= Long.MAX_VALUE - jitterMax) {
                wait += ThreadLocalRandom.current().nextLong(jitterMax + 1);
            }
        }
        return Duration.ofMillis(wait);
    }

    private void sleep(Duration wait) {
        if (wait.isZero()) return;
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FatalBackendException("Interrupted during retry backoff", 0, ie);
        }
    }
}
