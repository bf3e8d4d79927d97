package com.codeagent.shared.config;

import com.codeagent.shared.model.RuntimeMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable per-run agent configuration. Built once, shared read-only by
 * every task of the run.
 */
public record AgentSpec(
    String name,
    BackendConfig backend,
    String systemPrompt,
    List<String> allowedTools,
    Map<String, Object> decoding,
    Budget budget,
    SandboxConfig sandbox,
    RuntimeMode mode,
    String terminationTool
) {
    public static final String DEFAULT_TERMINATION_TOOL = "submit";

    public AgentSpec {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("agent name must not be empty");
        if (backend == null) throw new IllegalArgumentException("backend config must not be null");
        if (systemPrompt == null || systemPrompt.isBlank()) {
            throw new IllegalArgumentException("system prompt must not be empty");
        }
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : List.of();
        // decoding values may be null (skipped on the wire), so Map.copyOf is not usable here
        decoding = decoding != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(decoding))
                : Map.of();
        budget = budget != null ? budget : Budget.defaults();
        sandbox = sandbox != null ? sandbox : SandboxConfig.defaults();
        mode = mode != null ? mode : RuntimeMode.TOOLS_ENABLED;
        terminationTool = terminationTool != null && !terminationTool.isBlank()
                ? terminationTool : DEFAULT_TERMINATION_TOOL;
    }

    public AgentSpec(String name, BackendConfig backend, String systemPrompt,
                     List<String> allowedTools, Map<String, Object> decoding, Budget budget) {
        this(name, backend, systemPrompt, allowedTools, decoding, budget,
                SandboxConfig.defaults(), RuntimeMode.TOOLS_ENABLED, DEFAULT_TERMINATION_TOOL);
    }

    public boolean isToolAllowed(String toolName) {
        return allowedTools.isEmpty() || allowedTools.contains(toolName);
    }

    public AgentSpec withBudget(Budget newBudget) {
        return new AgentSpec(name, backend, systemPrompt, allowedTools, decoding,
                newBudget, sandbox, mode, terminationTool);
    }
}
