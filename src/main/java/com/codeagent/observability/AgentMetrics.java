package com.codeagent.observability;

import com.codeagent.providers.RetryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/** Meters for one agent process, registered lazily by name and tags. */
public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics() {
        this(new SimpleMeterRegistry());
    }

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer backendLatency() {
        return Timer.builder("codeagent.backend.latency").register(registry);
    }

    public Counter backendCalls() {
        return Counter.builder("codeagent.backend.calls").register(registry);
    }

    public Counter backendRetries() {
        return Counter.builder("codeagent.backend.retries").register(registry);
    }

    public Counter toolExecutions(String tool, String outcome) {
        return Counter.builder("codeagent.tool.executions")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Counter runs(String reason) {
        return Counter.builder("codeagent.runs").tag("reason", reason).register(registry);
    }

    /** Counts every scheduled backend retry. */
    public RetryPolicy.Listener retryListener() {
        return (attempt, delay, error) -> backendRetries().increment();
    }

    public void recordBackendCall(Duration latency) {
        backendCalls().increment();
        backendLatency().record(latency);
    }
}
