package io.contextrunr.alias;

/**
 * A participant matched by a name query.
 */
public record AliasCandidate(String participantId, String displayName, int score) {
}
