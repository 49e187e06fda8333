package io.contextrunr.thread;

/**
 * A thread with its relevance score.
 */
public record ScoredThread(ConversationThread thread, int score) {
}
