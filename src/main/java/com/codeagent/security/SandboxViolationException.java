package com.codeagent.security;

/** A tool argument tried to reach outside the task workspace. */
public class SandboxViolationException extends SecurityException {

    public SandboxViolationException(String message) {
        super(message);
    }
}
