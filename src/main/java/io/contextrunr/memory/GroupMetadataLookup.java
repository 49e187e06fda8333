package io.contextrunr.memory;

import java.util.Optional;

/**
 * Describes group conversations, typically backed by the messaging transport.
 */
public interface GroupMetadataLookup {

    /**
     * @param conversationId a group conversation id
     * @return the group's label data, or empty if unknown
     */
    Optional<GroupMetadata> describe(String conversationId);
}
