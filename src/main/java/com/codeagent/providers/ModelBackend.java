package com.codeagent.providers;

/**
 * One chat-completion provider. Implementations are stateless per call and
 * fail only with {@link TransientBackendException} or {@link FatalBackendException}.
 */
public interface ModelBackend {
    String id();
    GenerationResult generate(GenerationRequest request);

    /** False for backends that can only answer in text; they are limited to patch-only runs. */
    default boolean supportsToolCalls() {
        return true;
    }
}
