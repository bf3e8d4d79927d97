package com.codeagent.tools;

import com.codeagent.security.ToolExecutor;
import com.codeagent.security.WorkspaceSandbox;
import com.codeagent.shared.config.SandboxConfig;

import java.nio.file.Path;
import java.time.Duration;

/** Per-task execution scope handed to every tool call. */
public record ToolContext(
    WorkspaceSandbox sandbox,
    SandboxConfig config,
    ToolExecutor executor,
    SubmissionSlot submission
) {
    public static ToolContext forWorkspace(Path workspaceRoot, SandboxConfig config, ToolExecutor executor) {
        return new ToolContext(new WorkspaceSandbox(workspaceRoot, config.maxFileSizeBytes()),
                config, executor, new SubmissionSlot());
    }

    public Path workspaceRoot() { return sandbox.root(); }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(config.bashTimeoutSeconds());
    }

    public String truncate(String output) {
        if (output == null) return "";
        int limit = config.outputTruncate();
        if (output.length() <= limit) return output;
        return output.substring(0, limit) + "\n...[truncated " + (output.length() - limit) + " chars]";
    }
}
