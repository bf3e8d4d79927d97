package com.codeagent.shared.config;

public record SandboxConfig(
    long bashTimeoutSeconds,
    int outputTruncate,
    long maxFileSizeBytes
) {
    public SandboxConfig {
        if (bashTimeoutSeconds <= 0) throw new IllegalArgumentException("bashTimeoutSeconds must be > 0");
        if (outputTruncate <= 0) throw new IllegalArgumentException("outputTruncate must be > 0");
        if (maxFileSizeBytes <= 0) throw new IllegalArgumentException("maxFileSizeBytes must be > 0");
    }

    public static SandboxConfig defaults() {
        return new SandboxConfig(60, 4000, 10 * 1024 * 1024);
    }
}
