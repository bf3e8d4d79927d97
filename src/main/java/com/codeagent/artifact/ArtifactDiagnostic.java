package com.codeagent.artifact;

/** Non-blocking quality flags. Callers decide what a flag means for scoring. */
public enum ArtifactDiagnostic {
    EMPTY_PATCH("empty_patch"),
    MALFORMED_PATCH("malformed_patch"),
    EMPTY_JSON("empty_json"),
    MALFORMED_JSON("malformed_json"),
    EMPTY_TEXT("empty_text");

    private final String code;

    ArtifactDiagnostic(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
