package io.contextrunr.channel;

import io.contextrunr.classify.TopicClassifier;
import io.contextrunr.config.AgentProperties;
import io.contextrunr.core.Message;
import io.contextrunr.security.InputSanitizer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Turns transport payloads into canonical {@link Message} records.
 *
 * <p>Nothing past this class sees transport-specific shapes: ids are validated, text is
 * sanitized, the role is derived from the agent's id, and topics are tagged once here.</p>
 */
@Component
public class MessageCanonicalizer {

    private final InputSanitizer sanitizer;
    private final TopicClassifier topicClassifier;
    private final AgentProperties agent;
    private final Clock clock;

    public MessageCanonicalizer(InputSanitizer sanitizer, TopicClassifier topicClassifier,
                                AgentProperties agent, Clock clock) {
        this.sanitizer = sanitizer;
        this.topicClassifier = topicClassifier;
        this.agent = agent;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the conversation or sender id is missing or malformed
     */
    public Message canonicalize(String conversationId, InboundMessage inbound) {
        String chatId = sanitizer.requireId(conversationId, "conversationId");
        if (inbound == null) {
            throw new IllegalArgumentException("message is required");
        }
        String senderId = sanitizer.requireId(inbound.senderId(), "senderId");
        String id = inbound.id() == null || inbound.id().isBlank()
                ? UUID.randomUUID().toString()
                : sanitizer.requireId(inbound.id(), "id");

        String content = sanitizer.sanitize(inbound.text());
        Instant timestamp = inbound.timestamp() != null ? inbound.timestamp() : clock.instant();
        boolean fromAgent = agent.isAgent(senderId);
        String senderName = fromAgent ? agent.name() : senderName(inbound.senderName(), senderId);

        Message message = fromAgent
                ? Message.agent(id, chatId, senderId, senderName, content, timestamp)
                : Message.user(id, chatId, senderId, senderName, content, timestamp);
        message = message.withTopics(topicClassifier.classifyTopics(content));
        if (inbound.quotedMessageId() != null && !inbound.quotedMessageId().isBlank()) {
            message = message.replyingTo(sanitizer.requireId(inbound.quotedMessageId(), "quotedMessageId"));
        }
        return inbound.hasImage() ? message.withImage() : message;
    }

    /** Display name, falling back to the numeric part of the sender id. */
    static String senderName(String name, String senderId) {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        int at = senderId.indexOf('@');
        return at > 0 ? senderId.substring(0, at) : senderId;
    }
}
