package com.codeagent.agent;

import com.codeagent.shared.model.Message;
import com.codeagent.shared.model.Role;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void seedsSystemThenUser() {
        var messages = builder.build("You are a coding agent.", "Fix test_foo");

        assertEquals(2, messages.size());
        assertEquals(Role.SYSTEM, messages.get(0).role());
        assertEquals("You are a coding agent.", messages.get(0).content());
        assertEquals(Role.USER, messages.get(1).role());
        assertEquals("Fix test_foo", messages.get(1).content());
    }

    @Test
    void returnedListIsAppendable() {
        var messages = builder.build("sys", "task");
        messages.add(Message.assistant("ok", null));
        assertEquals(3, messages.size());
    }

    @Test
    void rejectsBlankInstruction() {
        assertThrows(IllegalArgumentException.class, () -> builder.build("sys", "  "));
    }
}
