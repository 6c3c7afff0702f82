package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * One entry of the conversation history sent to the language model.
 *
 * @param role    who produced the content
 * @param content message text (must not be null, may be empty only for system prompts)
 */
public record ChatMessage(Role role, String content) {

    /** Message author. */
    public enum Role { SYSTEM, USER, ASSISTANT }

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }
}
