package com.codeagent.providers;

import com.codeagent.shared.model.ToolCall;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a chat-completion payload into a {@link GenerationResult}. Malformed
 * tool calls never fail the request: the response degrades to text-only so
 * the model can correct itself on the next turn.
 */
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS = new TypeReference<>() {};

    private final ObjectMapper strictMapper = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    private final ObjectMapper mapper = new ObjectMapper();
    private final InlineToolCallExtractor inlineExtractor;

    public ResponseParser() {
        this(null);
    }

    /** @param inlineExtractor used when tools were offered but the provider returned none; may be null */
    public ResponseParser(InlineToolCallExtractor inlineExtractor) {
        this.inlineExtractor = inlineExtractor;
    }

    public GenerationResult parse(JsonNode root, boolean toolsOffered) {
        var choice = root.path("choices").path(0);
        var message = choice.path("message");
        var text = message.path("content").isTextual() ? message.path("content").asText() : "";
        var providerFinish = choice.path("finish_reason").asText("");

        List<ToolCall> toolCalls;
        try {
            toolCalls = parseToolCalls(message.path("tool_calls"));
        } catch (MalformedToolCallException e) {
            log.warn("Discarding malformed tool calls, treating response as text: {}", e.getMessage());
            return new GenerationResult(text, List.of(), FinishReason.STOP);
        }
        if (toolCalls.isEmpty() && toolsOffered && inlineExtractor != null) {
            toolCalls = inlineExtractor.extract(text);
        }
        return new GenerationResult(text, toolCalls, finishReason(providerFinish, toolCalls));
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        var calls = new ArrayList<ToolCall>();
        if (node.isMissingNode() || node.isNull()) return calls;
        if (!node.isArray()) throw new MalformedToolCallException("tool_calls is not an array");
        for (var tc : node) {
            var fn = tc.path("function");
            var name = fn.path("name").asText("");
            if (name.isBlank()) throw new MalformedToolCallException("tool call without a function name");
            var id = tc.path("id").isTextual() ? tc.path("id").asText() : null;
            calls.add(new ToolCall(id, name, parseArguments(name, fn.path("arguments"))));
        }
        return calls;
    }

    Map<String, Object> parseArguments(String toolName, JsonNode args) {
        if (args.isMissingNode() || args.isNull()) return Map.of();
        if (args.isObject()) return mapper.convertValue(args, ARGS);
        if (!args.isTextual()) {
            throw new MalformedToolCallException("arguments of " + toolName + " are not an object");
        }
        var raw = args.asText().strip();
        if (raw.isEmpty()) return Map.of();
        try {
            var parsed = strictMapper.readTree(raw);
            if (parsed == null || !parsed.isObject()) {
                throw new MalformedToolCallException("arguments of " + toolName + " are not a JSON object");
            }
            return strictMapper.convertValue(parsed, ARGS);
        } catch (JsonProcessingException e) {
            throw new MalformedToolCallException("arguments of " + toolName + " are not valid JSON: "
                    + e.getOriginalMessage());
        }
    }

    private static FinishReason finishReason(String providerFinish, List<ToolCall> toolCalls) {
        if (!toolCalls.isEmpty()) return FinishReason.TOOL_CALL;
        return switch (providerFinish) {
            case "length" -> FinishReason.LENGTH;
            case "error", "content_filter" -> FinishReason.ERROR;
            default -> FinishReason.STOP;
        };
    }

    static class MalformedToolCallException extends RuntimeException {
        MalformedToolCallException(String message) {
            super(message);
        }
    }
}
