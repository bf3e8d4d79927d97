package com.codeagent.shared.model;

import com.codeagent.artifact.OutputType;

import java.nio.file.Path;

/** One unit of agent work: what to do, where, and what kind of artifact to return. */
public record TaskSpec(
    String taskId,
    String instruction,
    Path workspaceRoot,
    OutputType expectedOutputType
) {
    public TaskSpec {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be empty");
        }
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("instruction must not be empty");
        }
        if (workspaceRoot == null) {
            throw new IllegalArgumentException("workspaceRoot must not be null");
        }
        expectedOutputType = expectedOutputType != null ? expectedOutputType : OutputType.TEXT;
    }
}
