package io.contextrunr.memory;

import java.util.List;
import java.util.Map;

/**
 * Read access to participant facts. Facts are written by an extraction collaborator;
 * context assembly only reads them.
 */
public interface FactStore {

    /**
     * Current facts about a participant, keyed by fact key.
     *
     * @param subjectId the participant id
     * @return facts by key, empty if none are known
     */
    Map<String, Fact> getFacts(String subjectId);

    /**
     * Superseded values for a participant, oldest first.
     */
    default List<Fact> getFactHistory(String subjectId) {
        return List.of();
    }

    /**
     * Counter bumped on every write, used to invalidate derived caches.
     */
    default long generation() {
        return 0L;
    }
}
