package com.phillippitts.talkback.domain;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, append-only conversation history for one session.
 *
 * <p><b>Invariants:</b>
 * <ul>
 *   <li>After {@link #reset(String)} the history holds exactly one {@link ChatMessage.Role#SYSTEM} entry</li>
 *   <li>Entries are only ever appended while the session runs; nothing is edited or removed</li>
 *   <li>{@link #clear()} empties the history when the session ends</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Writes are expected from the session loop only. Reads such as
 * {@link #snapshot()} are safe from any thread.
 *
 * @since 1.0
 */
public final class ConversationHistory {

    private final List<ChatMessage> messages = new CopyOnWriteArrayList<>();

    /**
     * Starts a fresh history containing only the system prompt.
     *
     * @param systemPrompt system prompt for the session (null is treated as empty)
     */
    public void reset(String systemPrompt) {
        messages.clear();
        messages.add(ChatMessage.system(systemPrompt == null ? "" : systemPrompt));
    }

    public void appendUser(String content) {
        append(ChatMessage.user(content));
    }

    public void appendAssistant(String content) {
        append(ChatMessage.assistant(content));
    }

    private void append(ChatMessage message) {
        if (messages.isEmpty()) {
            throw new IllegalStateException("History has no system entry; call reset() first");
        }
        messages.add(message);
    }

    /**
     * Returns an immutable copy of the current history.
     *
     * @return messages in chronological order
     */
    public List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public void clear() {
        messages.clear();
    }
}
