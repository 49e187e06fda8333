package io.contextrunr.channel;

import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import io.contextrunr.memory.ConversationStore;
import io.contextrunr.memory.FactAutoSaver;
import io.contextrunr.memory.FactStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records inbound messages into the conversation store and extracts facts from them.
 */
@Component
public class ConversationRecorder {

    private static final Logger log = LoggerFactory.getLogger(ConversationRecorder.class);

    private final ConversationStore conversationStore;
    private final MessageCanonicalizer canonicalizer;
    private final FactAutoSaver factAutoSaver;

    public ConversationRecorder(ConversationStore conversationStore, MessageCanonicalizer canonicalizer,
                                FactAutoSaver factAutoSaver) {
        this.conversationStore = conversationStore;
        this.canonicalizer = canonicalizer;
        this.factAutoSaver = factAutoSaver;
    }

    /**
     * Canonicalizes and appends a message, creating the conversation on its first message.
     *
     * @return the recorded message
     * @throws IllegalArgumentException if the payload is malformed
     */
    public Message record(String conversationId, InboundMessage inbound) {
        Message message = canonicalizer.canonicalize(conversationId, inbound);
        Conversation conversation = conversationStore.appendMessage(message.conversationId(), message);

        if (conversation.isGroup() && inbound.chatName() != null && !inbound.chatName().isBlank()
                && !inbound.chatName().trim().equals(conversation.getDisplayName())) {
            conversationStore.updateDisplayName(conversation.getId(), inbound.chatName());
            log.info("Group {} is now named '{}'", conversation.getId(), inbound.chatName().trim());
        }

        try {
            int saved = factAutoSaver.scanAndSave(message);
            if (saved > 0) {
                log.debug("Extracted {} fact(s) from message {}", saved, message.id());
            }
        } catch (FactStoreException e) {
            log.error("Failed to save facts from message {}: {}", message.id(), e.getMessage(), e);
        }
        return message;
    }

    /**
     * Clears a conversation's messages, keeping its participants.
     *
     * @return true if the conversation existed
     */
    public boolean clear(String conversationId) {
        boolean cleared = conversationStore.clearMessages(conversationId);
        if (cleared) {
            log.info("Cleared context for {}", conversationId);
        }
        return cleared;
    }
}
