package com.codeagent.agent;

/** Telemetry for one dispatched tool call. */
public record ToolCallEvent(
    int turnIndex,
    int callIndex,
    String toolName,
    boolean terminationTool,
    boolean allowed,
    boolean executed,
    boolean success,
    String errorCode,
    int argsSizeBytes,
    int resultSizeBytes,
    long latencyMs,
    Integer exitCode
) {}
