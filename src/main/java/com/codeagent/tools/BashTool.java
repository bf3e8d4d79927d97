package com.codeagent.tools;

import com.codeagent.security.ExecutionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class BashTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(BashTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "bash"; }

    @Override public String description() {
        return "Run a bash command inside the workspace root";
    }

    @Override public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        props.set("command", MAPPER.createObjectNode().put("type", "string"));
        props.set("timeout_s", MAPPER.createObjectNode().put("type", "integer"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", MAPPER.createArrayNode().add("command"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var command = ToolArguments.requireText(input, "command", "cmd");
        var timeoutArg = ToolArguments.optionalInt(input, "timeout_s");
        var timeout = timeoutArg != null && timeoutArg > 0
                ? Duration.ofSeconds(timeoutArg)
                : ctx.defaultTimeout();
        log.info("bash in {} (timeout {}s): {}", ctx.workspaceRoot(), timeout.toSeconds(), command);

        var result = ctx.executor().executeShell(command, ctx.workspaceRoot(), timeout);
        var content = render(ctx, result);
        if (result.timedOut()) {
            return ToolResult.failure(ToolErrorCode.TIMEOUT,
                    "command exceeded " + timeout.toSeconds() + "s", content, null);
        }
        if (result.exitCode() != 0) {
            return ToolResult.failure(ToolErrorCode.NONZERO_EXIT,
                    "command exited with " + result.exitCode(), content, result.exitCode());
        }
        return ToolResult.ok(content, result.exitCode());
    }

    private static String render(ToolContext ctx, ExecutionResult result) {
        return MAPPER.createObjectNode()
                .put("exit_code", result.exitCode())
                .put("timed_out", result.timedOut())
                .put("stdout", ctx.truncate(result.stdout()))
                .put("stderr", ctx.truncate(result.stderr()))
                .toString();
    }
}
