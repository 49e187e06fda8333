package io.contextrunr.memory;

import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository of conversations shared by every chat the agent takes part in.
 * Any engine (in-memory, file, database) can sit behind it.
 */
public interface ConversationStore {

    /**
     * Gets a conversation by id.
     *
     * @param conversationId the conversation id
     * @return the conversation, or empty if none was ever recorded
     */
    Optional<Conversation> getConversation(String conversationId);

    /**
     * Appends a message, creating the conversation on its first message.
     *
     * @param conversationId the conversation id
     * @param message        the canonical message
     * @return the conversation after the append
     */
    Conversation appendMessage(String conversationId, Message message);

    /**
     * Lists every conversation, ordered by id.
     */
    List<Conversation> listConversations();

    /**
     * Sets the display name of a conversation, if it exists.
     */
    void updateDisplayName(String conversationId, String displayName);

    /**
     * Clears the message log of a conversation, keeping participants.
     *
     * @return true if the conversation existed
     */
    boolean clearMessages(String conversationId);

    /**
     * Records that the agent introduced itself in a conversation.
     */
    void markIntroduced(String conversationId, Instant at);

    /**
     * Counter bumped on every mutation, used to invalidate derived caches.
     */
    long generation();
}
