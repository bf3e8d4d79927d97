package com.codeagent.tools;

import com.codeagent.security.ExecutionResult;
import com.codeagent.security.SandboxViolationException;
import com.codeagent.security.ToolExecutor;
import com.codeagent.shared.config.SandboxConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplyPatchToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String DIFF = "diff --git a/x.py b/x.py\n--- a/x.py\n+++ b/x.py\n@@ -1 +1 @@\n-a\n+b\n";

    @TempDir
    Path tempDir;

    private final List<List<String>> commands = new ArrayList<>();
    private final List<String> patchBodies = new ArrayList<>();

    private ToolContext contextReturning(ExecutionResult result) {
        ToolExecutor executor = new ToolExecutor() {
            @Override
            public ExecutionResult execute(List<String> command, Path workDir, Duration timeout) {
                commands.add(command);
                try {
                    patchBodies.add(Files.readString(Path.of(command.get(command.size() - 1))));
                } catch (Exception e) {
                    fail(e);
                }
                return result;
            }
        };
        return ToolContext.forWorkspace(tempDir, SandboxConfig.defaults(), executor);
    }

    @Test
    void runsPatchWithStripLevel() throws Exception {
        var ctx = contextReturning(new ExecutionResult("patching file x.py\n", "", 0, false));

        var result = new ApplyPatchTool().execute(ctx, MAPPER.createObjectNode().put("unified_diff", DIFF));

        assertTrue(result.success());
        assertEquals(List.of("patch", "-p1", "--batch", "--forward", "-i"), commands.get(0).subList(0, 5));
        assertEquals(DIFF, patchBodies.get(0));
        var payload = MAPPER.readTree(result.content());
        assertTrue(payload.get("success").asBoolean());
        assertEquals("patching file x.py\n", payload.get("output").asText());
    }

    @Test
    void tempPatchFileIsRemoved() {
        var ctx = contextReturning(new ExecutionResult("", "", 0, false));
        new ApplyPatchTool().execute(ctx, MAPPER.createObjectNode().put("unified_diff", DIFF));

        assertFalse(Files.exists(Path.of(commands.get(0).get(5))));
    }

    @Test
    void failedPatchIsNonzeroExit() throws Exception {
        var ctx = contextReturning(new ExecutionResult("", "Hunk #1 FAILED", 1, false));

        var result = new ApplyPatchTool().execute(ctx,
                MAPPER.createObjectNode().put("unified_diff", DIFF).put("strip", 0));

        assertTrue(result.isError());
        assertEquals(ToolErrorCode.NONZERO_EXIT, result.errorCode());
        assertEquals(1, result.exitCode());
        assertEquals("-p0", commands.get(0).get(1));
        assertFalse(MAPPER.readTree(result.content()).get("success").asBoolean());
    }

    @Test
    void rejectsTargetsOutsideWorkspace() {
        var ctx = contextReturning(new ExecutionResult("", "", 0, false));
        var evil = "--- a/../../etc/passwd\n+++ b/../../etc/passwd\n@@ -1 +1 @@\n-x\n+y\n";

        assertThrows(SandboxViolationException.class, () -> new ApplyPatchTool().execute(ctx,
                MAPPER.createObjectNode().put("unified_diff", evil)));
        assertTrue(commands.isEmpty());
    }

    @Test
    void blankDiffIsInvalid() {
        var ctx = contextReturning(new ExecutionResult("", "", 0, false));
        assertThrows(InvalidToolArgumentsException.class, () -> new ApplyPatchTool().execute(ctx,
                MAPPER.createObjectNode().put("unified_diff", "  ")));
    }

    @Test
    void stripComponentsDropsLeadingDirectories() {
        assertEquals("src/x.py", ApplyPatchTool.stripComponents("a/src/x.py", 1));
        assertEquals("x.py", ApplyPatchTool.stripComponents("x.py", 1));
        assertEquals("a/x.py", ApplyPatchTool.stripComponents("a/x.py", 0));
    }
}
