package com.codeagent.shared.model;

public enum Role {
    SYSTEM, USER, ASSISTANT, TOOL;

    public String wireName() {
        return name().toLowerCase();
    }
}
