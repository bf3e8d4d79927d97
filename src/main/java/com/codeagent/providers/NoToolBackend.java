package com.codeagent.providers;

import com.codeagent.shared.model.Role;

/** Offline stand-in that never calls tools: it echoes the last user message. */
public class NoToolBackend implements ModelBackend {

    @Override
    public String id() { return "noop"; }

    @Override
    public boolean supportsToolCalls() { return false; }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        var messages = request.messages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == Role.USER) {
                return GenerationResult.text(messages.get(i).content());
            }
        }
        return GenerationResult.text("");
    }
}
