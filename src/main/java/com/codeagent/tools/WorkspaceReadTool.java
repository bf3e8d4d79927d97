package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;

public class WorkspaceReadTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "workspace_read"; }

    @Override public String description() {
        return "Read a file relative to the workspace root, optionally a 1-based inclusive line range";
    }

    @Override public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        props.set("path", MAPPER.createObjectNode().put("type", "string"));
        props.set("start_line", MAPPER.createObjectNode().put("type", "integer"));
        props.set("end_line", MAPPER.createObjectNode().put("type", "integer"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", MAPPER.createArrayNode().add("path"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var rawPath = ToolArguments.requireText(input, "path");
        var start = ToolArguments.optionalInt(input, "start_line");
        var end = ToolArguments.optionalInt(input, "end_line");
        try {
            var file = ctx.sandbox().resolveReadableFile(rawPath);
            // lenient decoding: undecodable bytes become U+FFFD instead of failing the read
            var content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            if (start == null && end == null) {
                return ToolResult.ok(ctx.truncate(content));
            }
            return ToolResult.ok(ctx.truncate(slice(content, start, end)));
        } catch (NoSuchFileException e) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, "file not found: " + rawPath);
        } catch (IOException e) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, e.getMessage());
        }
    }

    static String slice(String content, Integer start, Integer end) {
        var lines = content.split("(?<=\n)", -1);
        int total = lines.length;
        if (total > 0 && lines[total - 1].isEmpty()) total--;
        int from = Math.max(1, start != null ? start : 1);
        int to = Math.min(total, end != null ? end : total);
        var sb = new StringBuilder();
        for (int i = from; i <= to; i++) sb.append(lines[i - 1]);
        return sb.toString();
    }
}
