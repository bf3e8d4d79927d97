package com.codeagent.shared.model;

public enum RuntimeMode {
    /** No tools are offered; the first text reply is the artifact. */
    PATCH_ONLY,
    TOOLS_ENABLED;

    public static RuntimeMode from(String value) {
        if (value == null || value.isBlank()) return TOOLS_ENABLED;
        return switch (value.strip().toLowerCase().replace('-', '_')) {
            case "patch_only" -> PATCH_ONLY;
            case "tools_enabled" -> TOOLS_ENABLED;
            default -> throw new IllegalArgumentException("Unknown runtime mode: " + value);
        };
    }
}
