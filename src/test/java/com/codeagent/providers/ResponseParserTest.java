package com.codeagent.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ResponseParser parser = new ResponseParser();

    private static JsonNode json(String s) throws Exception {
        return MAPPER.readTree(s);
    }

    @Test
    void parsesPlainText() throws Exception {
        var result = parser.parse(json("""
                {"choices":[{"message":{"role":"assistant","content":"hello"},"finish_reason":"stop"}]}
                """), true);

        assertEquals("hello", result.text());
        assertFalse(result.hasToolCalls());
        assertEquals(FinishReason.STOP, result.finishReason());
    }

    @Test
    void nullContentBecomesEmpty() throws Exception {
        var result = parser.parse(json("""
                {"choices":[{"message":{"content":null},"finish_reason":"length"}]}
                """), false);

        assertEquals("", result.text());
        assertEquals(FinishReason.LENGTH, result.finishReason());
    }

    @Test
    void parsesStringAndObjectArguments() throws Exception {
        var result = parser.parse(json("""
                {"choices":[{"message":{"content":"","tool_calls":[
                  {"id":"a","type":"function","function":{"name":"workspace_read","arguments":"{\\"path\\":\\"x.py\\"}"}},
                  {"type":"function","function":{"name":"submit","arguments":{"final_artifact":"done"}}}
                ]},"finish_reason":"tool_calls"}]}
                """), true);

        assertEquals(FinishReason.TOOL_CALL, result.finishReason());
        assertEquals(2, result.toolCalls().size());
        assertEquals("a", result.toolCalls().get(0).id());
        assertEquals(Map.of("path", "x.py"), result.toolCalls().get(0).arguments());
        assertNull(result.toolCalls().get(1).id());
        assertEquals("done", result.toolCalls().get(1).arguments().get("final_artifact"));
    }

    @Test
    void invalidArgumentJsonDegradesToText() throws Exception {
        var result = parser.parse(json("""
                {"choices":[{"message":{"content":"thinking","tool_calls":[
                  {"id":"a","function":{"name":"bash","arguments":"{not json"}}
                ]}}]}
                """), true);

        assertEquals("thinking", result.text());
        assertTrue(result.toolCalls().isEmpty());
        assertEquals(FinishReason.STOP, result.finishReason());
    }

    @Test
    void duplicateArgumentKeysDegradeToText() throws Exception {
        var result = parser.parse(json("""
                {"choices":[{"message":{"content":"","tool_calls":[
                  {"id":"a","function":{"name":"bash","arguments":"{\\"command\\":\\"ls\\",\\"command\\":\\"rm\\"}"}}
                ]}}]}
                """), true);

        assertFalse(result.hasToolCalls());
        assertEquals(FinishReason.STOP, result.finishReason());
    }

    @Test
    void missingNameOrNonObjectArgumentsDegradeToText() throws Exception {
        assertFalse(parser.parse(json("""
                {"choices":[{"message":{"tool_calls":[{"id":"a","function":{"arguments":"{}"}}]}}]}
                """), true).hasToolCalls());
        assertFalse(parser.parse(json("""
                {"choices":[{"message":{"tool_calls":[{"id":"a","function":{"name":"bash","arguments":"[1,2]"}}]}}]}
                """), true).hasToolCalls());
    }

    @Test
    void errorFinishReasons() throws Exception {
        assertEquals(FinishReason.ERROR, parser.parse(json("""
                {"choices":[{"message":{"content":"x"},"finish_reason":"content_filter"}]}
                """), false).finishReason());
        assertEquals(FinishReason.ERROR, parser.parse(json("""
                {"choices":[{"message":{"content":"x"},"finish_reason":"error"}]}
                """), false).finishReason());
    }

    @Test
    void inlineExtractionOnlyWhenEnabledAndToolsOffered() throws Exception {
        var body = json("""
                {"choices":[{"message":{"content":"<tool_call name=\\"submit\\">{\\"final_artifact\\": \\"x\\"}</tool_call>"}}]}
                """);

        assertFalse(parser.parse(body, true).hasToolCalls());

        var inline = new ResponseParser(new InlineToolCallExtractor());
        assertFalse(inline.parse(body, false).hasToolCalls());
        var result = inline.parse(body, true);
        assertEquals("submit", result.toolCalls().get(0).name());
        assertEquals(FinishReason.TOOL_CALL, result.finishReason());
    }

    @Test
    void blankInlineTagNameStaysText() throws Exception {
        var root = MAPPER.createObjectNode();
        root.putArray("choices").addObject().put("finish_reason", "stop")
                .putObject("message").put("content", "<tool_call name=\" \">{}</tool_call>");

        var result = new ResponseParser(new InlineToolCallExtractor()).parse(root, true);

        assertFalse(result.hasToolCalls());
        assertEquals(FinishReason.STOP, result.finishReason());
    }
}
