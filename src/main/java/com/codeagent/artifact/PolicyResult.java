package com.codeagent.artifact;

import java.util.List;

public record PolicyResult(String artifact, OutputType type, List<ArtifactDiagnostic> diagnostics) {

    public PolicyResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public boolean has(ArtifactDiagnostic diagnostic) {
        return diagnostics.contains(diagnostic);
    }
}
