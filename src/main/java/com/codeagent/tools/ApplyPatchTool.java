package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Applies a unified diff with {@code patch(1)} after checking every touched path. */
public class ApplyPatchTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(ApplyPatchTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "workspace_apply_patch"; }

    @Override public String description() {
        return "Apply a unified diff patch relative to the workspace root";
    }

    @Override public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        props.set("unified_diff", MAPPER.createObjectNode().put("type", "string"));
        props.set("strip", MAPPER.createObjectNode().put("type", "integer"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", MAPPER.createArrayNode().add("unified_diff"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var diff = ToolArguments.requireText(input, "unified_diff", "patch");
        var stripArg = ToolArguments.optionalInt(input, "strip");
        int strip = stripArg != null && stripArg >= 0 ? stripArg : 1;
        if (diff.isBlank()) {
            throw new InvalidToolArgumentsException("unified_diff must not be empty");
        }
        checkTargets(ctx, diff, strip);

        Path patchFile = null;
        try {
            patchFile = Files.createTempFile("codeagent-", ".diff");
            Files.writeString(patchFile, diff.endsWith("\n") ? diff : diff + "\n", StandardCharsets.UTF_8);
            var result = ctx.executor().execute(
                    List.of("patch", "-p" + strip, "--batch", "--forward", "-i", patchFile.toString()),
                    ctx.workspaceRoot(), ctx.defaultTimeout());
            var content = MAPPER.createObjectNode()
                    .put("success", !result.isError())
                    .put("output", ctx.truncate(result.combinedOutput()))
                    .toString();
            if (result.timedOut()) {
                return ToolResult.failure(ToolErrorCode.TIMEOUT, "patch timed out", content, null);
            }
            if (result.exitCode() != 0) {
                return ToolResult.failure(ToolErrorCode.NONZERO_EXIT,
                        "patch exited with " + result.exitCode(), content, result.exitCode());
            }
            return ToolResult.ok(content, 0);
        } catch (IOException e) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, e.getMessage());
        } finally {
            deleteQuietly(patchFile);
        }
    }

    private static void checkTargets(ToolContext ctx, String diff, int strip) {
        for (var line : diff.split("\n")) {
            if (!line.startsWith("--- ") && !line.startsWith("+++ ")) continue;
            var target = line.substring(4);
            int tab = target.indexOf('\t');
            if (tab >= 0) target = target.substring(0, tab);
            target = target.strip();
            if (target.isEmpty() || "/dev/null".equals(target)) continue;
            // throws SandboxViolationException for escaping targets
            ctx.sandbox().resolve(stripComponents(target, strip));
        }
    }

    static String stripComponents(String path, int strip) {
        var parts = path.split("/+");
        if (strip <= 0 || parts.length <= strip) return path;
        return String.join("/", List.of(parts).subList(strip, parts.length));
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp patch {}: {}", file, e.getMessage());
        }
    }
}
