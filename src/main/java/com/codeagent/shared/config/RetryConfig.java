package com.codeagent.shared.config;

public record RetryConfig(int maxRetries, long initialDelayMs, long maxDelayMs, double jitterRatio) {

    public RetryConfig {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("retry delays must be >= 0");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(8, 1_000, 10_000, 0.0);
    }
}
