package com.codeagent.agent;

import com.codeagent.shared.model.Message;

import java.util.ArrayList;
import java.util.List;

public class PromptBuilder {

    /** Seeds a fresh, mutable conversation: system prompt then task instruction. */
    public List<Message> build(String systemPrompt, String instruction) {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("instruction must not be empty");
        }
        var messages = new ArrayList<Message>();
        messages.add(Message.system(systemPrompt));
        messages.add(Message.user(instruction));
        return messages;
    }
}
