package com.codeagent.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool invocation requested by the model. Argument keys are unique;
 * iteration order follows the provider payload.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool call name must not be empty");
        }
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
