package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The terminal tool. Stores the artifact; the runtime stops after it. */
public class SubmitTool implements Tool {

    static final int PREVIEW_CHARS = 2000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "submit"; }

    @Override public String description() {
        return "Submit the final artifact (patch, text or JSON) and end the task";
    }

    @Override public JsonNode inputSchema() {
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties",
                        MAPPER.createObjectNode().set("final_artifact",
                                MAPPER.createObjectNode().put("type", "string")))
                .set("required", MAPPER.createArrayNode().add("final_artifact"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var node = input.has("final_artifact") ? input.get("final_artifact") : input.get("artifact");
        String artifact;
        if (node == null || node.isNull()) {
            artifact = "";
        } else if (node.isTextual()) {
            artifact = node.asText();
        } else {
            artifact = node.toString();
        }
        ctx.submission().submit(artifact);
        var preview = artifact.length() > PREVIEW_CHARS ? artifact.substring(0, PREVIEW_CHARS) : artifact;
        return ToolResult.ok(MAPPER.createObjectNode()
                .put("submitted", true)
                .put("artifact_preview", preview)
                .toString());
    }
}
