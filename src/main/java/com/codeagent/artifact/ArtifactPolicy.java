package com.codeagent.artifact;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a raw artifact against its expected output type. The artifact
 * is returned exactly as given; only diagnostics are added.
 */
public class ArtifactPolicy {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final List<String> DIFF_MARKERS = List.of("diff --git ", "--- ", "Index: ");

    public PolicyResult apply(String rawArtifact, OutputType type) {
        var artifact = rawArtifact != null ? rawArtifact : "";
        var outputType = type != null ? type : OutputType.TEXT;
        var diagnostics = new ArrayList<ArtifactDiagnostic>();
        switch (outputType) {
            case PATCH -> checkPatch(artifact, diagnostics);
            case JSON -> checkJson(artifact, diagnostics);
            case TEXT -> {
                if (artifact.isBlank()) diagnostics.add(ArtifactDiagnostic.EMPTY_TEXT);
            }
        }
        return new PolicyResult(artifact, outputType, diagnostics);
    }

    private static void checkPatch(String artifact, List<ArtifactDiagnostic> diagnostics) {
        if (artifact.isBlank()) {
            diagnostics.add(ArtifactDiagnostic.EMPTY_PATCH);
            return;
        }
        var body = artifact.stripLeading();
        if (DIFF_MARKERS.stream().noneMatch(body::startsWith)) {
            diagnostics.add(ArtifactDiagnostic.MALFORMED_PATCH);
        }
    }

    private static void checkJson(String artifact, List<ArtifactDiagnostic> diagnostics) {
        if (artifact.isBlank()) {
            diagnostics.add(ArtifactDiagnostic.EMPTY_JSON);
            return;
        }
        try {
            MAPPER.readTree(artifact);
        } catch (Exception e) {
            diagnostics.add(ArtifactDiagnostic.MALFORMED_JSON);
        }
    }
}
