package com.codeagent.tools;

import com.fasterxml.jackson.databind.JsonNode;

/** Typed accessors over a tool's JSON arguments. */
public final class ToolArguments {

    private ToolArguments() {}

    public static String requireText(JsonNode input, String... names) {
        for (var name : names) {
            var node = input.get(name);
            if (node != null && node.isTextual()) return node.asText();
        }
        throw new InvalidToolArgumentsException("missing required string argument '" + names[0] + "'");
    }

    public static String optionalText(JsonNode input, String name, String fallback) {
        var node = input.get(name);
        if (node == null || node.isNull()) return fallback;
        if (!node.isTextual()) {
            throw new InvalidToolArgumentsException("argument '" + name + "' must be a string");
        }
        return node.asText();
    }

    public static Integer optionalInt(JsonNode input, String name) {
        var node = input.get(name);
        if (node == null || node.isNull()) return null;
        if (node.canConvertToInt() && node.isIntegralNumber()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().strip());
            } catch (NumberFormatException e) {
                throw new InvalidToolArgumentsException("argument '" + name + "' must be an integer");
            }
        }
        throw new InvalidToolArgumentsException("argument '" + name + "' must be an integer");
    }
}
