package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

public class WorkspaceListTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "workspace_list"; }

    @Override public String description() {
        return "List files and directories under a path relative to the workspace root";
    }

    @Override public JsonNode inputSchema() {
        return MAPPER.createObjectNode()
                .put("type", "object")
                .set("properties",
                        MAPPER.createObjectNode().set("path",
                                MAPPER.createObjectNode().put("type", "string")));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var rawPath = ToolArguments.optionalText(input, "path", ".");
        var dir = ctx.sandbox().resolve(rawPath);
        if (!Files.exists(dir)) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, "path not found: " + rawPath);
        }
        if (!Files.isDirectory(dir)) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, "not a directory: " + rawPath);
        }
        var result = MAPPER.createObjectNode().put("path", ctx.sandbox().relativize(dir));
        var entries = result.putArray("entries");
        try (var stream = Files.list(dir)) {
            stream.sorted(Comparator.comparing(Path::getFileName))
                    .forEach(p -> entries.addObject()
                            .put("name", p.getFileName().toString())
                            .put("type", Files.isDirectory(p) ? "dir" : "file"));
        } catch (IOException e) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, e.getMessage());
        }
        return ToolResult.ok(ctx.truncate(result.toString()));
    }
}
