package io.contextrunr.memory;

import io.contextrunr.core.Conversation;

import java.util.Optional;

/**
 * Group metadata derived from recorded conversations: the stored display name and the
 * number of participants seen so far.
 */
public class StoreGroupMetadataLookup implements GroupMetadataLookup {

    private final ConversationStore conversationStore;

    public StoreGroupMetadataLookup(ConversationStore conversationStore) {
        this.conversationStore = conversationStore;
    }

    @Override
    public Optional<GroupMetadata> describe(String conversationId) {
        return conversationStore.getConversation(conversationId)
                .filter(Conversation::isGroup)
                .map(c -> new GroupMetadata(c.getDisplayName(), c.getParticipants().size()));
    }
}
