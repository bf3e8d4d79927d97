package com.codeagent.shared.config;

import java.time.Duration;

/** Per-task ceilings. Consumed monotonically, never replenished. */
public record Budget(int maxToolCalls, Duration maxWallTime) {

    public Budget {
        if (maxToolCalls < 0) throw new IllegalArgumentException("maxToolCalls must be >= 0");
        if (maxWallTime == null || maxWallTime.isNegative() || maxWallTime.isZero()) {
            throw new IllegalArgumentException("maxWallTime must be positive");
        }
    }

    public static Budget defaults() {
        return new Budget(20, Duration.ofSeconds(600));
    }
}
