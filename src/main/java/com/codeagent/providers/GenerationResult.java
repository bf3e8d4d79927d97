package com.codeagent.providers;

import com.codeagent.shared.model.ToolCall;

import java.util.List;

public record GenerationResult(String text, List<ToolCall> toolCalls, FinishReason finishReason) {

    public GenerationResult {
        text = text != null ? text : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        finishReason = finishReason != null ? finishReason
                : (toolCalls.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALL);
    }

    public static GenerationResult text(String text) {
        return new GenerationResult(text, List.of(), FinishReason.STOP);
    }

    public static GenerationResult toolCalls(String text, List<ToolCall> calls) {
        return new GenerationResult(text, calls, FinishReason.TOOL_CALL);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
