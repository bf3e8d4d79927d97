package com.codeagent.providers;

public enum FinishReason {
    STOP, TOOL_CALL, LENGTH, ERROR
}
