package com.codeagent.artifact;

public enum OutputType {
    TEXT, PATCH, JSON;

    /** Case-insensitive lookup; blank or unknown values fall back to {@link #TEXT}. */
    public static OutputType from(String value) {
        if (value == null || value.isBlank()) return TEXT;
        return switch (value.strip().toLowerCase()) {
            case "patch" -> PATCH;
            case "json" -> JSON;
            default -> TEXT;
        };
    }
}
