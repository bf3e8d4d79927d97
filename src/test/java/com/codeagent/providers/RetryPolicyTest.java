package com.codeagent.providers;

import com.codeagent.shared.config.RetryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @Test
    void successOnFirstAttempt() {
        var policy = new RetryPolicy(new RetryConfig(3, 100, 1000, 0), recordingSleeper, RetryPolicy.Listener.NONE);
        assertEquals("ok", policy.execute(() -> "ok"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void recoversAfterTransientFailuresWithCappedExponentialDelays() {
        var policy = new RetryPolicy(new RetryConfig(5, 100, 250, 0), recordingSleeper, RetryPolicy.Listener.NONE);
        var attempts = new AtomicInteger();

        var result = policy.execute(() -> {
            if (attempts.incrementAndGet() <= 4) throw new TransientBackendException("503");
            return "recovered";
        });

        assertEquals("recovered", result);
        assertEquals(5, attempts.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200),
                Duration.ofMillis(250), Duration.ofMillis(250)), sleeps);
        var total = sleeps.stream().mapToLong(Duration::toMillis).sum();
        assertEquals(800, total);
    }

    @Test
    void exhaustionBecomesFatalWithLastErrorAsCause() {
        var policy = new RetryPolicy(new RetryConfig(2, 10, 100, 0), recordingSleeper, RetryPolicy.Listener.NONE);
        var attempts = new AtomicInteger();

        var ex = assertThrows(FatalBackendException.class, () -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new TransientBackendException("rate limited", 429, null, null);
        }));

        assertEquals(3, attempts.get());
        assertEquals(2, sleeps.size());
        assertTrue(ex.getMessage().startsWith("Backend call failed after 3 attempts"));
        assertEquals(429, ex.statusCode());
        assertInstanceOf(TransientBackendException.class, ex.getCause());
    }

    @Test
    void fatalErrorsAreNotRetried() {
        var policy = new RetryPolicy(new RetryConfig(5, 10, 100, 0), recordingSleeper, RetryPolicy.Listener.NONE);
        var attempts = new AtomicInteger();

        assertThrows(FatalBackendException.class, () -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new FatalBackendException("401 unauthorized");
        }));

        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void retryAfterRaisesDelayUpToMax() {
        var policy = new RetryPolicy(new RetryConfig(3, 100, 5000, 0));

        var shortHint = new TransientBackendException("429", 429, Duration.ofMillis(50), null);
        var longHint = new TransientBackendException("429", 429, Duration.ofSeconds(2), null);
        var hugeHint = new TransientBackendException("429", 429, Duration.ofSeconds(60), null);

        assertEquals(Duration.ofMillis(100), policy.delayFor(0, shortHint));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(0, longHint));
        assertEquals(Duration.ofMillis(5000), policy.delayFor(0, hugeHint));
    }

    @Test
    void jitterStaysWithinBound() {
        var policy = new RetryPolicy(new RetryConfig(3, 1000, 10_000, 0.5));
        var error = new TransientBackendException("503");
        for (int i = 0; i < 20; i++) {
            long wait = policy.delayFor(1, error).toMillis();
            assertTrue(wait >= 2000 && wait <= 3000, "unexpected delay " + wait);
        }
    }

    @Test
    void listenerSeesEveryRetry() {
        var seen = new ArrayList<Integer>();
        var policy = new RetryPolicy(new RetryConfig(2, 0, 0, 0), recordingSleeper,
                (attempt, delay, error) -> seen.add(attempt));

        assertThrows(FatalBackendException.class,
                () -> policy.execute(() -> { throw new TransientBackendException("timeout"); }));

        assertEquals(List.of(1, 2), seen);
        assertTrue(sleeps.isEmpty(), "zero delays are not slept");
    }

    @Test
    void hugeMaxDelayDoesNotOverflow() {
        var policy = new RetryPolicy(new RetryConfig(3, 1000, Long.MAX_VALUE, 0.5),
                recordingSleeper, RetryPolicy.Listener.NONE);

        assertEquals(Duration.ofMillis(1000L << 40), policy.baseDelay(40));
        assertEquals(Duration.ofMillis(Long.MAX_VALUE), policy.baseDelay(200));
        assertFalse(policy.delayFor(200, new TransientBackendException("503")).isNegative());
    }
}
