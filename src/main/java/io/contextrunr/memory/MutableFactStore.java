package io.contextrunr.memory;

/**
 * Fact store that also accepts writes from fact extraction.
 */
public interface MutableFactStore extends FactStore {

    /**
     * Stores a fact, moving any different previous value for the same key to the history.
     *
     * @param fact the fact to store
     */
    void recordFact(Fact fact);

    /**
     * Deletes a fact.
     *
     * @return true if the fact existed
     */
    boolean forget(String subjectId, String key);
}
