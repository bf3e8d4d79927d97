package com.codeagent.providers;

import com.codeagent.shared.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristic recovery of tool calls that small models write into plain text:
 * fenced {@code json} blocks with a {@code name}, and
 * {@code <tool_call name="...">{...}</tool_call>} tags. Unparseable fragments are skipped.
 */
public class InlineToolCallExtractor {

    private static final Pattern FENCED_JSON = Pattern.compile(
            "```json\\s*(\\{[\\s\\S]*?\\})\\s*```", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAGGED = Pattern.compile(
            "<tool_call\\s+name=\"([^\"]+)\">([\\s\\S]*?)</tool_call>");
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    public List<ToolCall> extract(String text) {
        var calls = new ArrayList<ToolCall>();
        if (text == null || text.isEmpty()) return calls;

        var fenced = FENCED_JSON.matcher(text);
        while (fenced.find()) {
            var payload = readOrNull(fenced.group(1));
            if (payload == null) continue;
            var fn = payload.path("function");
            var name = payload.path("name").asText(fn.path("name").asText(""));
            if (name.isBlank()) continue;
            var args = payload.has("arguments") ? payload.get("arguments") : fn.path("arguments");
            calls.add(new ToolCall(null, name, toArguments(args, args.toString())));
        }

        var tagged = TAGGED.matcher(text);
        while (tagged.find()) {
            if (tagged.group(1).isBlank()) continue;
            var body = tagged.group(2).strip();
            var parsed = readOrNull(body);
            calls.add(new ToolCall(null, tagged.group(1),
                    parsed != null ? toArguments(parsed, body) : Map.of("raw", body)));
        }
        return calls;
    }

    private Map<String, Object> toArguments(JsonNode args, String raw) {
        if (args == null || args.isMissingNode() || args.isNull()) return Map.of();
        if (args.isTextual()) {
            var nested = readOrNull(args.asText());
            if (nested == null) return Map.of("raw", args.asText());
            args = nested;
        }
        if (!args.isObject()) return Map.of("raw", raw);
        return mapper.convertValue(args, ARGS);
    }

    private JsonNode readOrNull(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
