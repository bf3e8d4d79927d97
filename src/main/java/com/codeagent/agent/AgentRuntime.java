package com.codeagent.agent;

import com.codeagent.artifact.ArtifactDiagnostic;
import com.codeagent.artifact.ArtifactPolicy;
import com.codeagent.observability.AgentMetrics;
import com.codeagent.providers.BackendException;
import com.codeagent.providers.GenerationRequest;
import com.codeagent.providers.GenerationResult;
import com.codeagent.providers.ModelBackend;
import com.codeagent.security.ProcessExecutor;
import com.codeagent.security.ToolExecutor;
import com.codeagent.shared.config.AgentSpec;
import com.codeagent.shared.model.Message;
import com.codeagent.shared.model.Role;
import com.codeagent.shared.model.RuntimeMode;
import com.codeagent.shared.model.TaskSpec;
import com.codeagent.shared.model.ToolCall;
import com.codeagent.tools.ToolContext;
import com.codeagent.tools.ToolErrorCode;
import com.codeagent.tools.ToolRegistry;
import com.codeagent.tools.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives one task to exactly one {@link AgentResult}: one backend request per
 * turn, tool calls dispatched in model order, budgets checked before every
 * request and every dispatch.
 *
 * <p>An instance holds no per-task state and may run many tasks, one at a time
 * or from independent threads.
 */
public class AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    // model-invented tool names share one meter tag
    static final String UNKNOWN_TOOL_TAG = "unknown";

    private final ModelBackend backend;
    private final ToolRegistry toolRegistry;
    private final AgentSpec spec;
    private final ToolExecutor executor;
    private final AgentMetrics metrics;
    private final MonotonicClock clock;
    private final ArtifactPolicy artifactPolicy = new ArtifactPolicy();
    private final PromptBuilder promptBuilder = new PromptBuilder();

    public AgentRuntime(ModelBackend backend, ToolRegistry toolRegistry, AgentSpec spec) {
        this(backend, toolRegistry, spec, new ProcessExecutor(), new AgentMetrics(), MonotonicClock.SYSTEM);
    }

    public AgentRuntime(ModelBackend backend, ToolRegistry toolRegistry, AgentSpec spec,
                        ToolExecutor executor, AgentMetrics metrics, MonotonicClock clock) {
        if (spec.mode() == RuntimeMode.TOOLS_ENABLED && !backend.supportsToolCalls()) {
            throw new IllegalArgumentException("Backend " + backend.id()
                    + " cannot call tools; run agent " + spec.name() + " in patch_only mode");
        }
        this.backend = backend;
        this.toolRegistry = toolRegistry;
        this.spec = spec;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
    }

    public AgentResult run(TaskSpec task) {
        var run = new TaskRun(task);
        log.info("Task {} started: backend={} mode={} maxToolCalls={} maxWallTime={}s",
                task.taskId(), backend.id(), spec.mode(), spec.budget().maxToolCalls(),
                spec.budget().maxWallTime().toSeconds());
        return run.execute();
    }

    /** Mutable state of one task; never escapes {@link #run}. */
    private final class TaskRun {

        private final TaskSpec task;
        private final List<Message> messages;
        private final BudgetTracker budget;
        private final ToolContext ctx;
        private final List<Map<String, Object>> toolSchemas;
        private final List<ToolCallEvent> events = new ArrayList<>();
        private final List<String> diagnostics = new ArrayList<>();
        private int turn;
        private int requests;

        TaskRun(TaskSpec task) {
            this.task = task;
            this.messages = promptBuilder.build(spec.systemPrompt(), task.instruction());
            this.budget = new BudgetTracker(spec.budget(), clock);
            this.ctx = ToolContext.forWorkspace(task.workspaceRoot(), spec.sandbox(), executor);
            this.toolSchemas = spec.mode() == RuntimeMode.TOOLS_ENABLED
                    ? toolRegistry.schemas(spec::isToolAllowed)
                    : List.of();
        }

        AgentResult execute() {
            while (true) {
                var exhausted = budget.exhaustion();
                if (exhausted.isPresent()) {
                    return budgetExceeded(exhausted.get());
                }

                GenerationResult result;
                long started = clock.nanos();
                requests++;
                try {
                    result = backend.generate(new GenerationRequest(messages, toolSchemas, spec.decoding()));
                } catch (BackendException e) {
                    diagnostics.add("backend_error: " + e.getMessage());
                    return finish(TerminationReason.BACKEND_ERROR, lastAssistantText());
                } finally {
                    metrics.recordBackendCall(Duration.ofNanos(Math.max(0, clock.nanos() - started)));
                }

                var calls = withIds(result.toolCalls());
                messages.add(Message.assistant(result.text(), calls));

                if (calls.isEmpty()) {
                    if (spec.mode() == RuntimeMode.PATCH_ONLY) {
                        return finish(TerminationReason.COMPLETED, result.text());
                    }
                    log.debug("Task {} turn {}: text-only reply ({}), continuing",
                            task.taskId(), turn, result.finishReason());
                    turn++;
                    continue;
                }

                for (int idx = 0; idx < calls.size(); idx++) {
                    exhausted = budget.exhaustion();
                    if (exhausted.isPresent()) {
                        return budgetExceeded(exhausted.get());
                    }
                    var call = calls.get(idx);
                    var toolResult = dispatch(call, idx);
                    if (isSubmission(call, toolResult)) {
                        if (idx < calls.size() - 1) {
                            log.info("Task {}: {} call(s) after {} not executed",
                                    task.taskId(), calls.size() - idx - 1, call.name());
                        }
                        return finish(TerminationReason.SUBMITTED, ctx.submission().artifact());
                    }
                }
                turn++;
            }
        }

        private ToolResult dispatch(ToolCall call, int idx) {
            budget.recordToolCall();
            long started = clock.nanos();
            var result = toolRegistry.dispatch(call, ctx, spec::isToolAllowed);
            long latencyMs = Duration.ofNanos(Math.max(0, clock.nanos() - started)).toMillis();

            var code = result.errorCode();
            events.add(new ToolCallEvent(
                    turn, idx, call.name(),
                    call.name().equals(spec.terminationTool()),
                    code != ToolErrorCode.NOT_ALLOWED,
                    code != ToolErrorCode.NOT_ALLOWED && code != ToolErrorCode.UNKNOWN_TOOL,
                    result.success(),
                    code.code(),
                    sizeOf(call.arguments()),
                    result.content().getBytes(StandardCharsets.UTF_8).length,
                    latencyMs,
                    result.exitCode()));
            var toolTag = code == ToolErrorCode.UNKNOWN_TOOL ? UNKNOWN_TOOL_TAG : call.name();
            metrics.toolExecutions(toolTag, result.success() ? "success" : code.code()).increment();
            if (result.isError()) {
                log.info("Task {} tool {} failed ({}): {}", task.taskId(), call.name(), code.code(), result.reason());
            }
            messages.add(Message.tool(call.id(), call.name(), result.content()));
            return result;
        }

        private boolean isSubmission(ToolCall call, ToolResult result) {
            return call.name().equals(spec.terminationTool())
                    && result.success()
                    && ctx.submission().isSubmitted();
        }

        private List<ToolCall> withIds(List<ToolCall> calls) {
            var out = new ArrayList<ToolCall>(calls.size());
            for (int i = 0; i < calls.size(); i++) {
                var c = calls.get(i);
                out.add(c.id() != null && !c.id().isBlank()
                        ? c
                        : new ToolCall("call_" + budget.toolCallsUsed() + "_" + i, c.name(), c.arguments()));
            }
            return out;
        }

        private AgentResult budgetExceeded(String diagnostic) {
            diagnostics.add(diagnostic);
            return finish(TerminationReason.BUDGET_EXCEEDED, lastAssistantText());
        }

        private String lastAssistantText() {
            for (int i = messages.size() - 1; i >= 0; i--) {
                var m = messages.get(i);
                if (m.role() == Role.ASSISTANT && !m.content().isBlank()) return m.content();
            }
            return "";
        }

        private AgentResult finish(TerminationReason reason, String rawArtifact) {
            var policy = artifactPolicy.apply(rawArtifact, task.expectedOutputType());
            var all = new ArrayList<>(diagnostics);
            for (ArtifactDiagnostic d : policy.diagnostics()) all.add(d.code());

            var elapsed = budget.elapsed();
            metrics.runs(reason.code()).increment();
            log.info("Task {} finished: reason={} toolCalls={} requests={} elapsed={}ms diagnostics={}",
                    task.taskId(), reason.code(), budget.toolCallsUsed(), requests, elapsed.toMillis(), all);
            return new AgentResult(task.taskId(), policy.artifact(), policy.type(), reason,
                    all, policy.diagnostics(), messages, events, budget.toolCallsUsed(), elapsed);
        }
    }

    private static int sizeOf(Map<String, Object> arguments) {
        try {
            return MAPPER.writeValueAsBytes(arguments).length;
        } catch (JsonProcessingException e) {
            return String.valueOf(arguments).getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
