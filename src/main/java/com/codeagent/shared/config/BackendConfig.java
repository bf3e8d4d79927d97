package com.codeagent.shared.config;

public record BackendConfig(
    String type,
    String model,
    String baseUrl,
    String apiKeyEnv,
    long timeoutSeconds,
    boolean extractInlineToolCalls,
    RetryConfig retry
) {
    public BackendConfig {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("backend type must not be empty");
        type = type.strip().toLowerCase();
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("backend timeout must be > 0");
        retry = retry != null ? retry : RetryConfig.defaults();
    }

    public static BackendConfig openRouter(String model) {
        return new BackendConfig("openrouter", model, null, "OPENROUTER_API_KEY", 60, false, RetryConfig.defaults());
    }

    public static BackendConfig noop() {
        return new BackendConfig("noop", null, null, null, 60, false, RetryConfig.defaults());
    }
}
