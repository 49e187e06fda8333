package io.contextrunr.memory;

import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Conversation store kept in process memory.
 *
 * <p>Each conversation caps its own log at {@code context.max-context-messages}.
 * Appends to one conversation are serialized by the conversation itself.</p>
 */
@Component
public class InMemoryConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

    private final ConcurrentHashMap<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final int maxContextMessages;

    public InMemoryConversationStore(ContextProperties properties) {
        this.maxContextMessages = properties.maxContextMessages();
    }

    @Override
    public Optional<Conversation> getConversation(String conversationId) {
        if (conversationId == null) return Optional.empty();
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public Conversation appendMessage(String conversationId, Message message) {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(message, "message");

        Conversation conversation = conversations.computeIfAbsent(conversationId, id -> {
            log.info("Created conversation {} ({})", id, Conversation.Kind.fromConversationId(id));
            return new Conversation(id, Conversation.Kind.fromConversationId(id), maxContextMessages);
        });
        conversation.append(message);
        generation.incrementAndGet();
        log.debug("Appended message {} to {} ({} messages)", message.id(), conversationId, conversation.size());
        return conversation;
    }

    @Override
    public List<Conversation> listConversations() {
        return conversations.values().stream()
                .sorted(Comparator.comparing(Conversation::getId))
                .toList();
    }

    @Override
    public void updateDisplayName(String conversationId, String displayName) {
        Conversation conversation = conversations.get(conversationId);
        if (conversation != null) {
            conversation.setDisplayName(displayName);
            generation.incrementAndGet();
        }
    }

    @Override
    public boolean clearMessages(String conversationId) {
        Conversation conversation = conversations.get(conversationId);
        if (conversation == null) {
            return false;
        }
        conversation.clearMessages();
        generation.incrementAndGet();
        return true;
    }

    @Override
    public void markIntroduced(String conversationId, Instant at) {
        Conversation conversation = conversations.get(conversationId);
        if (conversation != null) {
            conversation.markIntroduced(at);
            generation.incrementAndGet();
        }
    }

    @Override
    public long generation() {
        return generation.get();
    }
}
