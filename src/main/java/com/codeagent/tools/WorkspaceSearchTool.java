package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Regex search across workspace files, capped at {@value #MAX_MATCHES} matches. */
public class WorkspaceSearchTool implements Tool {

    static final int MAX_MATCHES = 50;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "workspace_search"; }

    @Override public String description() {
        return "Search for a regex pattern in workspace files, optionally filtered by a glob";
    }

    @Override public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        props.set("query", MAPPER.createObjectNode().put("type", "string"));
        props.set("glob", MAPPER.createObjectNode().put("type", "string"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", MAPPER.createArrayNode().add("query"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var query = ToolArguments.requireText(input, "query");
        var glob = ToolArguments.optionalText(input, "glob", "**/*");
        Pattern pattern;
        PathMatcher matcher;
        try {
            pattern = Pattern.compile(query);
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (IllegalArgumentException e) {
            throw new InvalidToolArgumentsException(e.getMessage());
        }
        var root = ctx.sandbox().root();
        var result = MAPPER.createObjectNode();
        var matches = result.putArray("matches");
        List<Path> files;
        try (var stream = Files.walk(root)) {
            // symlinks are skipped so the walk never reads outside the workspace
            files = stream.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .filter(p -> !root.relativize(p).startsWith(".git"))
                    .filter(p -> globMatches(matcher, glob, root.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_FAILURE, e.getMessage());
        }
        for (var file : files) {
            var content = readUtf8(file, ctx.config().maxFileSizeBytes());
            if (content == null) continue;
            if (collect(pattern, content, ctx.sandbox().relativize(file), matches)) {
                result.put("truncated", true);
                return ToolResult.ok(ctx.truncate(result.toString()));
            }
        }
        result.put("truncated", false);
        return ToolResult.ok(ctx.truncate(result.toString()));
    }

    /** Returns true once the match cap is hit. */
    private static boolean collect(Pattern pattern, String content, String file, ArrayNode matches) {
        var m = pattern.matcher(content);
        while (m.find()) {
            int line = 1;
            for (int i = 0; i < m.start(); i++) {
                if (content.charAt(i) == '\n') line++;
            }
            matches.addObject().put("file", file).put("line", line).put("match", m.group());
            if (matches.size() >= MAX_MATCHES) return true;
        }
        return false;
    }

    private static boolean globMatches(PathMatcher matcher, String glob, Path relative) {
        if (matcher.matches(relative)) return true;
        // "**/x" should also match "x" at the top level
        return glob.startsWith("**/") && relative.getNameCount() == 1
                && FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)).matches(relative);
    }

    private static String readUtf8(Path file, long maxBytes) {
        try {
            if (Files.size(file) > maxBytes) return null;
            var decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            return decoder.decode(ByteBuffer.wrap(Files.readAllBytes(file))).toString();
        } catch (IOException e) {
            // binary or unreadable files are skipped
            return null;
        }
    }
}
