package io.contextrunr.alias;

/**
 * A group conversation matched by a chat name query.
 */
public record ChatCandidate(String conversationId, String displayName, int score) {
}
