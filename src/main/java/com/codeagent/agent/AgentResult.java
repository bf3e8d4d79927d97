package com.codeagent.agent;

import com.codeagent.artifact.ArtifactDiagnostic;
import com.codeagent.artifact.OutputType;
import com.codeagent.shared.model.Message;

import java.time.Duration;
import java.util.List;

/**
 * Final outcome of one task. {@code diagnostics} holds runtime notes followed
 * by artifact flag codes; {@code artifactDiagnostics} holds the flags typed.
 */
public record AgentResult(
    String taskId,
    String artifact,
    OutputType expectedType,
    TerminationReason terminationReason,
    List<String> diagnostics,
    List<ArtifactDiagnostic> artifactDiagnostics,
    List<Message> transcript,
    List<ToolCallEvent> toolCallEvents,
    int toolCallsUsed,
    Duration elapsed
) {
    public AgentResult {
        artifact = artifact != null ? artifact : "";
        diagnostics = List.copyOf(diagnostics);
        artifactDiagnostics = List.copyOf(artifactDiagnostics);
        transcript = List.copyOf(transcript);
        toolCallEvents = List.copyOf(toolCallEvents);
    }

    public boolean isSubmitted() {
        return terminationReason == TerminationReason.SUBMITTED;
    }
}
