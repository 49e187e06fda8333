package io.contextrunr.memory;

/**
 * Label data for a group conversation.
 */
public record GroupMetadata(String displayName, int memberCount) {
}
