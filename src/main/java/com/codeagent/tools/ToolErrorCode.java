package com.codeagent.tools;

public enum ToolErrorCode {
    NONE("none"),
    UNKNOWN_TOOL("unknown_tool"),
    NOT_ALLOWED("not_allowed"),
    INVALID_ARGUMENTS("invalid_arguments"),
    SANDBOX_VIOLATION("sandbox_violation"),
    EXECUTION_FAILURE("tool_error"),
    NONZERO_EXIT("nonzero_returncode"),
    TIMEOUT("timeout"),
    EXECUTION_EXCEPTION("execution_exception");

    private final String code;

    ToolErrorCode(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
