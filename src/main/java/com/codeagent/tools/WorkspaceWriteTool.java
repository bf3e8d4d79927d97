package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.StandardOpenOption;

public class WorkspaceWriteTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "workspace_write"; }

    @Override public String description() {
        return "Write full content to a file relative to the workspace root (overwrite)";
    }

    @Override public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        props.set("path", MAPPER.createObjectNode().put("type", "string"));
        props.set("content", MAPPER.createObjectNode().put("type", "string"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", MAPPER.createArrayNode().add("path").add("content"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var rawPath = ToolArguments.requireText(input, "path");
        var content = ToolArguments.requireText(input, "content");
        var sandbox = ctx.sandbox();
        var target = sandbox.resolve(rawPath);
        if (target.equals(sandbox.root()) || Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, "path is a directory: " + rawPath);
        }
        // Reject writing through an existing symlink target.
        if (Files.isSymbolicLink(target)) {
            return ToolResult.failure(ToolErrorCode.SANDBOX_VIOLATION, "Target is a symlink: " + rawPath);
        }
        try {
            Files.createDirectories(target.getParent());
            try (var out = Files.newOutputStream(
                    target,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE,
                    LinkOption.NOFOLLOW_LINKS)) {
                out.write(content.getBytes(StandardCharsets.UTF_8));
            }
            return ToolResult.ok(MAPPER.createObjectNode()
                    .put("written", sandbox.relativize(target))
                    .put("bytes", content.getBytes(StandardCharsets.UTF_8).length)
                    .toString());
        } catch (IOException e) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, e.getMessage());
        }
    }
}
