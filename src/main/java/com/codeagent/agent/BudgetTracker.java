package com.codeagent.agent;

import com.codeagent.shared.config.Budget;

import java.time.Duration;
import java.util.Optional;

/** Per-task budget counters. Both only ever grow. */
final class BudgetTracker {

    static final String TOOL_CALL_CEILING = "tool_call_ceiling_reached";
    static final String WALL_TIME_EXCEEDED = "wall_time_exceeded";

    private final Budget budget;
    private final MonotonicClock clock;
    private final long startNanos;
    private int toolCallsUsed;

    BudgetTracker(Budget budget, MonotonicClock clock) {
        this.budget = budget;
        this.clock = clock;
        this.startNanos = clock.nanos();
    }

    void recordToolCall() {
        toolCallsUsed++;
    }

    int toolCallsUsed() { return toolCallsUsed; }

    Duration elapsed() {
        return Duration.ofNanos(Math.max(0, clock.nanos() - startNanos));
    }

    /** Empty while budget remains; otherwise a diagnostic naming the exhausted ceiling. */
    Optional<String> exhaustion() {
        var elapsed = elapsed();
        if (elapsed.compareTo(budget.maxWallTime()) > 0) {
            return Optional.of(WALL_TIME_EXCEEDED + ": elapsed " + elapsed.toMillis()
                    + " ms, limit " + budget.maxWallTime().toMillis() + " ms");
        }
        if (toolCallsUsed >= budget.maxToolCalls()) {
            return Optional.of(TOOL_CALL_CEILING + ": " + toolCallsUsed + "/" + budget.maxToolCalls());
        }
        return Optional.empty();
    }
}
