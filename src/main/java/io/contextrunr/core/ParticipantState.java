package io.contextrunr.core;

import java.time.Instant;

/**
 * Per-conversation activity of a single participant.
 *
 * @param id                 participant id
 * @param displayName        latest known display name
 * @param messageCount       number of messages sent in this conversation
 * @param firstSeenAt        first message time
 * @param lastActiveAt       latest message time
 * @param lastMessagePreview first {@value #PREVIEW_LENGTH} characters of the latest message
 */
public record ParticipantState(
        String id,
        String displayName,
        int messageCount,
        Instant firstSeenAt,
        Instant lastActiveAt,
        String lastMessagePreview
) {
    static final int PREVIEW_LENGTH = 100;

    public static ParticipantState firstMessage(String id, String displayName, String content, Instant at) {
        return new ParticipantState(id, displayName, 1, at, at, preview(content));
    }

    /** Returns the state after one more message from this participant. */
    public ParticipantState recordMessage(String name, String content, Instant at) {
        String resolvedName = name != null && !name.isBlank() ? name : displayName;
        Instant latest = lastActiveAt == null || at.isAfter(lastActiveAt) ? at : lastActiveAt;
        return new ParticipantState(id, resolvedName, messageCount + 1, firstSeenAt, latest, preview(content));
    }

    private static String preview(String content) {
        if (content == null) return "";
        return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "..." : content;
    }
}
