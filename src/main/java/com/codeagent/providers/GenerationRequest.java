package com.codeagent.providers;

import com.codeagent.shared.model.Message;

import java.util.List;
import java.util.Map;

public record GenerationRequest(
    List<Message> messages,
    List<Map<String, Object>> tools,
    Map<String, Object> decoding
) {
    public GenerationRequest {
        messages = List.copyOf(messages);
        tools = tools != null ? tools : List.of();
        decoding = decoding != null ? decoding : Map.of();
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
