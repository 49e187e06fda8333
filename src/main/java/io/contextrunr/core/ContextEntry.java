package io.contextrunr.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One role-tagged text entry of a context window.
 *
 * @param role        SYSTEM, USER or ASSISTANT
 * @param content     the text handed to the response generator
 * @param sourceLabel where the entry came from (e.g. {@code conversation}, {@code facts})
 * @param priority    final sort key, lower sorts first
 * @param timestamp   time of the underlying message, or of assembly for injected entries
 * @param messageId   underlying message id, or null for injected entries
 */
public record ContextEntry(
        Role role,
        String content,
        String sourceLabel,
        int priority,
        Instant timestamp,
        String messageId
) {
    public static final int PRIORITY_CHAT_HEADER = 0;
    public static final int PRIORITY_CONVERSATION = 10;
    public static final int PRIORITY_CROSS_CHAT = 20;
    public static final int PRIORITY_IMAGE = 30;
    public static final int PRIORITY_FACTS = 40;

    public static final String SOURCE_CONVERSATION = "conversation";

    public enum Role {
        SYSTEM, USER, ASSISTANT
    }

    public ContextEntry {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(sourceLabel, "sourceLabel");
    }

    /** Wraps a conversation message, attributing user messages to their sender. */
    public static ContextEntry fromMessage(Message message) {
        Role role = message.role() == Message.Role.AGENT ? Role.ASSISTANT : Role.USER;
        String content = role == Role.USER && message.senderName() != null && !message.senderName().isBlank()
                ? message.senderName() + ": " + message.content()
                : message.content();
        return new ContextEntry(role, content, SOURCE_CONVERSATION, PRIORITY_CONVERSATION,
                message.timestamp(), message.id());
    }

    /** Creates an injected system entry with no underlying message. */
    public static ContextEntry system(String content, String sourceLabel, int priority, Instant timestamp) {
        return new ContextEntry(Role.SYSTEM, content, sourceLabel, priority, timestamp, null);
    }

    public boolean isInjected() {
        return messageId == null;
    }
}
