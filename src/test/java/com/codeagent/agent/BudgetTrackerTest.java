package com.codeagent.agent;

import com.codeagent.shared.config.Budget;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class BudgetTrackerTest {

    private final AtomicLong now = new AtomicLong(1_000);

    @Test
    void toolCallCeilingIsInclusive() {
        var tracker = new BudgetTracker(new Budget(2, Duration.ofSeconds(10)), now::get);

        assertTrue(tracker.exhaustion().isEmpty());
        tracker.recordToolCall();
        assertTrue(tracker.exhaustion().isEmpty());
        tracker.recordToolCall();
        assertEquals("tool_call_ceiling_reached: 2/2", tracker.exhaustion().orElseThrow());
    }

    @Test
    void wallTimeIsReportedFirst() {
        var tracker = new BudgetTracker(new Budget(0, Duration.ofSeconds(10)), now::get);
        now.addAndGet(Duration.ofSeconds(11).toNanos());

        var diagnostic = tracker.exhaustion().orElseThrow();

        assertTrue(diagnostic.startsWith(BudgetTracker.WALL_TIME_EXCEEDED), diagnostic);
        assertEquals(Duration.ofSeconds(11), tracker.elapsed());
    }

    @Test
    void exactlyAtLimitIsStillWithinBudget() {
        var tracker = new BudgetTracker(new Budget(5, Duration.ofSeconds(10)), now::get);
        now.addAndGet(Duration.ofSeconds(10).toNanos());

        assertTrue(tracker.exhaustion().isEmpty());
    }
}
