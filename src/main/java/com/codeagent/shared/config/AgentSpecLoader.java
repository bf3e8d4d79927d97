package com.codeagent.shared.config;

import com.codeagent.shared.model.RuntimeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads an agent profile YAML into an {@link AgentSpec}.
 *
 * <p>The system prompt comes from exactly one of {@code prompt_template} or
 * {@code prompt_file}. A {@code {skills}} placeholder in it is replaced with
 * the concatenated {@code skills/<name>/SKILL.md} files listed under
 * {@code skills}.
 */
public class AgentSpecLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentSpecLoader.class);

    static final String MODEL_OVERRIDE_ENV = "CODEAGENT_MODEL";
    static final String SKILLS_PLACEHOLDER = "{skills}";

    public static AgentSpec load(Path profile) {
        var parent = profile.toAbsolutePath().getParent();
        return load(profile, parent, System::getenv);
    }

    @SuppressWarnings("unchecked")
    public static AgentSpec load(Path profile, Path baseDir, Function<String, String> env) {
        Map<String, Object> raw;
        try (var in = Files.newInputStream(profile)) {
            raw = new Yaml().load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load agent profile: " + profile, e);
        }
        if (raw == null) raw = Map.of();

        var backend = (Map<String, Object>) raw.getOrDefault("backend", Map.of());
        var budget = (Map<String, Object>) raw.getOrDefault("budget", Map.of());
        var sandbox = (Map<String, Object>) raw.getOrDefault("sandbox", Map.of());
        var termination = (Map<String, Object>) raw.getOrDefault("termination", Map.of());
        var decoding = (Map<String, Object>) raw.getOrDefault("decoding_defaults", Map.of());
        var skillNames = stringList(raw.get("skills"));

        var profileDir = profile.toAbsolutePath().getParent();
        var skills = loadSkills(baseDir.resolve("skills"), skillNames);
        var prompt = resolvePrompt(raw, profileDir, baseDir).replace(SKILLS_PLACEHOLDER, skills.text());

        var tools = new ArrayList<>(stringList(raw.get("tools")));
        if (!tools.isEmpty()) {
            for (var t : skills.allowedTools()) {
                if (!tools.contains(t)) tools.add(t);
            }
        }

        return new AgentSpec(
            (String) raw.getOrDefault("name", profileName(profile)),
            parseBackend(backend, env),
            prompt,
            tools,
            new LinkedHashMap<>(decoding),
            parseBudget(budget),
            parseSandbox(sandbox),
            RuntimeMode.from((String) raw.get("mode")),
            (String) termination.get("tool")
        );
    }

    static BackendConfig parseBackend(Map<String, Object> backend, Function<String, String> env) {
        var retryDefaults = RetryConfig.defaults();
        var model = env.apply(MODEL_OVERRIDE_ENV);
        if (model == null || model.isBlank()) model = (String) backend.get("model");
        return new BackendConfig(
            (String) backend.getOrDefault("type", "openrouter"),
            model,
            (String) backend.get("base_url"),
            (String) backend.getOrDefault("api_key_env", "OPENROUTER_API_KEY"),
            toLong(backend.getOrDefault("timeout_s", 60)),
            Boolean.TRUE.equals(backend.getOrDefault("extract_inline_tool_calls", false)),
            new RetryConfig(
                (int) toLong(backend.getOrDefault("max_retries", retryDefaults.maxRetries())),
                toLong(backend.getOrDefault("initial_backoff_ms", retryDefaults.initialDelayMs())),
                toLong(backend.getOrDefault("max_backoff_ms", retryDefaults.maxDelayMs())),
                toDouble(backend.getOrDefault("jitter", retryDefaults.jitterRatio()))
            )
        );
    }

    private static Budget parseBudget(Map<String, Object> budget) {
        var defaults = Budget.defaults();
        return new Budget(
            (int) toLong(budget.getOrDefault("max_tool_calls", defaults.maxToolCalls())),
            Duration.ofSeconds(toLong(budget.getOrDefault("max_wall_time_s", defaults.maxWallTime().toSeconds())))
        );
    }

    private static SandboxConfig parseSandbox(Map<String, Object> sandbox) {
        var defaults = SandboxConfig.defaults();
        return new SandboxConfig(
            toLong(sandbox.getOrDefault("bash_timeout_s", defaults.bashTimeoutSeconds())),
            (int) toLong(sandbox.getOrDefault("output_truncate", defaults.outputTruncate())),
            toLong(sandbox.getOrDefault("max_file_size", defaults.maxFileSizeBytes()))
        );
    }

    private static String resolvePrompt(Map<String, Object> raw, Path profileDir, Path baseDir) {
        var template = (String) raw.get("prompt_template");
        var file = (String) raw.get("prompt_file");
        if (template != null && file != null) {
            throw new IllegalArgumentException("Agent profile must set only one of prompt_template or prompt_file");
        }
        if (template != null) return template;
        if (file == null) {
            throw new IllegalArgumentException("Agent profile must set prompt_template or prompt_file");
        }
        for (var dir : List.of(profileDir, baseDir)) {
            var candidate = dir.resolve(file);
            if (Files.isRegularFile(candidate)) {
                try {
                    return Files.readString(candidate);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read prompt file: " + candidate, e);
                }
            }
        }
        throw new IllegalArgumentException("Prompt file not found: " + file);
    }

    record Skills(String text, Set<String> allowedTools) {}

    /** Missing skill directories are logged and skipped. */
    static Skills loadSkills(Path skillsDir, List<String> names) {
        var sections = new ArrayList<String>();
        var allowed = new LinkedHashSet<String>();
        for (var name : names.stream().sorted().toList()) {
            var skillFile = skillsDir.resolve(name).resolve("SKILL.md");
            if (!Files.isRegularFile(skillFile)) {
                log.warn("Skill {} not found at {}", name, skillFile);
                continue;
            }
            try {
                var text = Files.readString(skillFile);
                sections.add("[Skill: " + name + "]\n" + text);
                allowed.addAll(allowedTools(text));
            } catch (IOException e) {
                log.warn("Failed to load skill {}: {}", name, e.getMessage());
            }
        }
        return new Skills(String.join("\n\n", sections), allowed);
    }

    /** Bullet list following an {@code Allowed Tools:} line. */
    static Set<String> allowedTools(String skillText) {
        var tools = new LinkedHashSet<String>();
        var lines = skillText.lines().toList();
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).strip().equalsIgnoreCase("allowed tools:")) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) return tools;
        for (var line : lines.subList(start, lines.size())) {
            var stripped = line.strip();
            if (stripped.isEmpty()) continue;
            if (!stripped.startsWith("-")) break;
            var tool = stripped.replaceFirst("^-+", "").strip();
            if (!tool.isEmpty()) tools.add(tool);
        }
        return tools;
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof List<?> list)) return List.of();
        return list.stream().map(String::valueOf).toList();
    }

    private static String profileName(Path profile) {
        var file = profile.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    private static long toLong(Object value) {
        if (value instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(value).strip());
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        return Double.parseDouble(String.valueOf(value).strip());
    }
}
