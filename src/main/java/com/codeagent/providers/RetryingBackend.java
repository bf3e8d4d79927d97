package com.codeagent.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator: retries transient failures of the wrapped backend. Callers only
 * ever see a result or a {@link FatalBackendException}.
 */
public class RetryingBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(RetryingBackend.class);

    private final ModelBackend delegate;
    private final RetryPolicy retryPolicy;

    public RetryingBackend(ModelBackend delegate, RetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String id() { return delegate.id(); }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        try {
            return retryPolicy.execute(() -> delegate.generate(request));
        } catch (FatalBackendException e) {
            log.error("Backend {} failed: {}", delegate.id(), e.getMessage());
            throw e;
        }
    }

    public ModelBackend delegate() { return delegate; }
}
