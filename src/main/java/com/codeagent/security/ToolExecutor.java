package com.codeagent.security;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public interface ToolExecutor {
    ExecutionResult execute(List<String> command, Path workDir, Duration timeout);

    default ExecutionResult executeShell(String command, Path workDir, Duration timeout) {
        return execute(List.of("bash", "-c", command), workDir, timeout);
    }
}
