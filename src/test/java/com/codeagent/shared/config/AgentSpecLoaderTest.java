package com.codeagent.shared.config;

import com.codeagent.shared.model.RuntimeMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentSpecLoaderTest {

    @TempDir
    Path tempDir;

    private Path profile(String yaml) throws IOException {
        var dir = Files.createDirectories(tempDir.resolve("agents"));
        return Files.writeString(dir.resolve("swe.yaml"), yaml);
    }

    private AgentSpec load(Path profile, Map<String, String> env) {
        return AgentSpecLoader.load(profile, tempDir, env::get);
    }

    @Test
    void loadsFullProfile() throws IOException {
        var path = profile("""
                name: swe-agent
                mode: tools_enabled
                backend:
                  type: openrouter
                  model: qwen2.5-coder-7b-instruct
                  api_key_env: OR_KEY
                  timeout_s: 90
                  extract_inline_tool_calls: true
                  max_retries: 4
                  initial_backoff_ms: 500
                  max_backoff_ms: 4000
                prompt_template: "You fix bugs."
                tools: [workspace_read, bash, submit]
                decoding_defaults:
                  temperature: 0.2
                  max_tokens: 2048
                budget:
                  max_tool_calls: 30
                  max_wall_time_s: 900
                sandbox:
                  bash_timeout_s: 30
                  output_truncate: 8000
                  max_file_size: 2048
                termination:
                  tool: finish
                """);

        var spec = load(path, Map.of());

        assertEquals("swe-agent", spec.name());
        assertEquals("openrouter", spec.backend().type());
        assertEquals("qwen2.5-coder-7b-instruct", spec.backend().model());
        assertEquals("OR_KEY", spec.backend().apiKeyEnv());
        assertEquals(90, spec.backend().timeoutSeconds());
        assertTrue(spec.backend().extractInlineToolCalls());
        assertEquals(new RetryConfig(4, 500, 4000, 0.0), spec.backend().retry());
        assertEquals("You fix bugs.", spec.systemPrompt());
        assertEquals(List.of("workspace_read", "bash", "submit"), spec.allowedTools());
        assertEquals(0.2, spec.decoding().get("temperature"));
        assertEquals(2048, spec.decoding().get("max_tokens"));
        assertEquals(new Budget(30, Duration.ofSeconds(900)), spec.budget());
        assertEquals(new SandboxConfig(30, 8000, 2048), spec.sandbox());
        assertEquals(RuntimeMode.TOOLS_ENABLED, spec.mode());
        assertEquals("finish", spec.terminationTool());
    }

    @Test
    void minimalProfileUsesDefaults() throws IOException {
        var spec = load(profile("prompt_template: hi\nbackend:\n  type: noop\n"), Map.of());

        assertEquals("swe", spec.name());
        assertEquals(Budget.defaults(), spec.budget());
        assertEquals(SandboxConfig.defaults(), spec.sandbox());
        assertEquals(RetryConfig.defaults(), spec.backend().retry());
        assertEquals(AgentSpec.DEFAULT_TERMINATION_TOOL, spec.terminationTool());
        assertTrue(spec.allowedTools().isEmpty());
        assertTrue(spec.isToolAllowed("bash"));
    }

    @Test
    void environmentOverridesModel() throws IOException {
        var path = profile("prompt_template: hi\nbackend:\n  type: openai\n  model: gpt-4o\n");

        var spec = load(path, Map.of("CODEAGENT_MODEL", "gpt-4.1-mini"));

        assertEquals("gpt-4.1-mini", spec.backend().model());
    }

    @Test
    void patchOnlyMode() throws IOException {
        var spec = load(profile("prompt_template: hi\nmode: patch-only\n"), Map.of());
        assertEquals(RuntimeMode.PATCH_ONLY, spec.mode());
    }

    @Test
    void promptFileResolvesAgainstProfileThenBaseDir() throws IOException {
        Files.writeString(tempDir.resolve("base_prompt.md"), "from base dir");
        var fromBase = load(profile("prompt_file: base_prompt.md\n"), Map.of());
        assertEquals("from base dir", fromBase.systemPrompt());

        Files.writeString(tempDir.resolve("agents/base_prompt.md"), "next to profile");
        var fromProfile = load(profile("prompt_file: base_prompt.md\n"), Map.of());
        assertEquals("next to profile", fromProfile.systemPrompt());
    }

    @Test
    void bothPromptSourcesAreRejected() throws IOException {
        var path = profile("prompt_template: a\nprompt_file: b.md\n");
        var ex = assertThrows(IllegalArgumentException.class, () -> load(path, Map.of()));
        assertTrue(ex.getMessage().contains("only one"));
    }

    @Test
    void missingPromptIsRejected() throws IOException {
        var path = profile("name: empty\n");
        assertThrows(IllegalArgumentException.class, () -> load(path, Map.of()));
    }

    @Test
    void missingPromptFileIsRejected() throws IOException {
        var path = profile("prompt_file: nowhere.md\n");
        var ex = assertThrows(IllegalArgumentException.class, () -> load(path, Map.of()));
        assertEquals("Prompt file not found: nowhere.md", ex.getMessage());
    }

    @Test
    void invalidBudgetIsRejected() throws IOException {
        var path = profile("prompt_template: hi\nbudget:\n  max_tool_calls: -1\n");
        assertThrows(IllegalArgumentException.class, () -> load(path, Map.of()));
    }

    @Test
    void unreadableProfileFails() {
        assertThrows(UncheckedIOException.class,
                () -> AgentSpecLoader.load(tempDir.resolve("missing.yaml"), tempDir, name -> null));
    }

    @Test
    void skillsFillPlaceholderAndExtendTools() throws IOException {
        var skill = Files.createDirectories(tempDir.resolve("skills/testing"));
        Files.writeString(skill.resolve("SKILL.md"), """
                Run the tests before submitting.

                Allowed Tools:
                - bash
                - workspace_search

                Notes follow here.
                """);
        var path = profile("""
                prompt_template: "Base prompt.\\n{skills}"
                tools: [submit]
                skills: [testing, absent]
                """);

        var spec = load(path, Map.of());

        assertTrue(spec.systemPrompt().startsWith("Base prompt.\n[Skill: testing]\nRun the tests"));
        assertEquals(List.of("submit", "bash", "workspace_search"), spec.allowedTools());
    }

    @Test
    void allowedToolsBlockEndsAtFirstNonBullet() {
        var tools = AgentSpecLoader.allowedTools("intro\nallowed tools:\n\n- a\n-  b\nnext section\n- c\n");
        assertEquals(Set.of("a", "b"), tools);
        assertTrue(AgentSpecLoader.allowedTools("no block here").isEmpty());
    }
}
