package com.codeagent.tools;

import com.codeagent.security.SandboxViolationException;
import com.codeagent.shared.model.ToolCall;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Fixed set of named tools. Holds no per-task state: the workspace and the
 * submission slot travel in the {@link ToolContext}.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public static ToolRegistry withDefaults() {
        var registry = new ToolRegistry();
        registry.register(new WorkspaceReadTool());
        registry.register(new WorkspaceWriteTool());
        registry.register(new WorkspaceListTool());
        registry.register(new WorkspaceSearchTool());
        registry.register(new ApplyPatchTool());
        registry.register(new BashTool());
        registry.register(new SubmitTool());
        return registry;
    }

    public void register(Tool tool) {
        if (tools.containsKey(tool.name())) {
            throw new IllegalArgumentException("Duplicate tool: " + tool.name());
        }
        tools.put(tool.name(), tool);
    }

    public Tool get(String name) {
        return tools.get(name);
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    /** OpenAI-style function definitions for the tools that pass {@code allowed}. */
    public List<Map<String, Object>> schemas(Predicate<String> allowed) {
        var defs = new ArrayList<Map<String, Object>>();
        for (Tool t : tools.values()) {
            if (!allowed.test(t.name())) continue;
            var fn = new LinkedHashMap<String, Object>();
            fn.put("name", t.name());
            fn.put("description", t.description());
            fn.put("parameters", MAPPER.convertValue(t.inputSchema(), Map.class));
            defs.add(Map.of("type", "function", "function", fn));
        }
        return defs;
    }

    /** Never throws for tool-level problems; every outcome is a {@link ToolResult}. */
    public ToolResult dispatch(ToolCall call, ToolContext ctx, Predicate<String> allowed) {
        var tool = tools.get(call.name());
        if (tool == null) {
            return ToolResult.failure(ToolErrorCode.UNKNOWN_TOOL, "Unknown tool: " + call.name())
                    .withCallId(call.id());
        }
        if (!allowed.test(call.name())) {
            return ToolResult.failure(ToolErrorCode.NOT_ALLOWED, "Tool " + call.name() + " not allowed")
                    .withCallId(call.id());
        }
        try {
            var input = MAPPER.valueToTree(call.arguments());
            return tool.execute(ctx, input).withCallId(call.id());
        } catch (InvalidToolArgumentsException e) {
            var reason = "invalid arguments for " + call.name() + ": " + e.getMessage()
                    + " (provided keys: " + new TreeSet<>(call.arguments().keySet()) + ")";
            return ToolResult.failure(ToolErrorCode.INVALID_ARGUMENTS, reason).withCallId(call.id());
        } catch (SandboxViolationException e) {
            log.warn("Sandbox violation in {}: {}", call.name(), e.getMessage());
            return ToolResult.failure(ToolErrorCode.SANDBOX_VIOLATION, e.getMessage()).withCallId(call.id());
        } catch (RuntimeException e) {
            log.warn("Tool {} threw {}", call.name(), e.toString());
            return ToolResult.failure(ToolErrorCode.EXECUTION_EXCEPTION,
                    "tool execution exception: " + e.getClass().getSimpleName() + ": " + e.getMessage())
                    .withCallId(call.id());
        }
    }
}
