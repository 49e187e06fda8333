package io.contextrunr.thread;

import java.util.Set;

/**
 * Inputs for thread ranking.
 *
 * @param agentId       the agent's participant id
 * @param activeSenders the most active senders of the conversation
 * @param topK          number of threads to keep
 */
public record ThreadRankingContext(String agentId, Set<String> activeSenders, int topK) {

    public ThreadRankingContext {
        activeSenders = activeSenders == null ? Set.of() : Set.copyOf(activeSenders);
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
    }
}
