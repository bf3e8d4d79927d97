package com.codeagent.security;

public record ExecutionResult(String stdout, String stderr, int exitCode, boolean timedOut) {

    public boolean isError() {
        return timedOut || exitCode != 0;
    }

    /** stdout followed by stderr, the way a terminal would show them. */
    public String combinedOutput() {
        if (stderr.isEmpty()) return stdout;
        if (stdout.isEmpty()) return stderr;
        return stdout.endsWith("\n") ? stdout + stderr : stdout + "\n" + stderr;
    }
}
