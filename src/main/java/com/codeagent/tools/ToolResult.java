package com.codeagent.tools;

/**
 * Outcome of one tool call. Failures are data, not exceptions: the content
 * is fed back to the model so it can react.
 */
public record ToolResult(
    String callId,
    boolean success,
    String content,
    ToolErrorCode errorCode,
    String reason,
    Integer exitCode
) {
    public ToolResult {
        content = content != null ? content : "";
        errorCode = errorCode != null ? errorCode : (success ? ToolErrorCode.NONE : ToolErrorCode.EXECUTION_FAILURE);
    }

    public static ToolResult ok(String content) {
        return new ToolResult(null, true, content, ToolErrorCode.NONE, null, null);
    }

    public static ToolResult ok(String content, int exitCode) {
        return new ToolResult(null, true, content, ToolErrorCode.NONE, null, exitCode);
    }

    public static ToolResult failure(ToolErrorCode code, String reason) {
        return new ToolResult(null, false, "[ERROR] " + reason, code, reason, null);
    }

    public static ToolResult failure(ToolErrorCode code, String reason, String content, Integer exitCode) {
        return new ToolResult(null, false, content, code, reason, exitCode);
    }

    public ToolResult withCallId(String id) {
        return new ToolResult(id, success, content, errorCode, reason, exitCode);
    }

    public boolean isError() {
        return !success;
    }
}
