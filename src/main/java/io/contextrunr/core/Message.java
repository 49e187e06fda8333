package io.contextrunr.core;

import io.contextrunr.classify.TopicTag;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A canonical message in a conversation log. Immutable once created.
 *
 * @param id             unique message id (transport id)
 * @param conversationId the conversation this message belongs to
 * @param senderId       sender participant id
 * @param senderName     sender display name at the time of sending
 * @param content        message text (never null, may be empty)
 * @param timestamp      when the message was sent (UTC)
 * @param role           USER for people, AGENT for the agent's own messages
 * @param topics         topic tags assigned when the message was recorded
 * @param isReply        whether the message quotes an earlier message
 * @param repliedToId    id of the quoted message, or null
 * @param hasImage       whether the message carried an image or is an image analysis
 */
public record Message(
        String id,
        String conversationId,
        String senderId,
        String senderName,
        String content,
        Instant timestamp,
        Role role,
        Set<TopicTag> topics,
        boolean isReply,
        String repliedToId,
        boolean hasImage
) {
    public static final String IMAGE_ANALYSIS_PREFIX = "[IMAGE ANALYSIS:";

    public enum Role {
        USER, AGENT
    }

    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(role, "role");
        if (content == null) {
            content = "";
        }
        topics = topics == null || topics.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(topics));
        if (repliedToId != null && repliedToId.isBlank()) {
            repliedToId = null;
        }
    }

    /** Creates a plain user message with no topics and no reply. */
    public static Message user(String id, String conversationId, String senderId, String senderName,
                               String content, Instant timestamp) {
        return new Message(id, conversationId, senderId, senderName, content, timestamp,
                Role.USER, Set.of(), false, null, false);
    }

    /** Creates a plain agent message. */
    public static Message agent(String id, String conversationId, String agentId, String agentName,
                                String content, Instant timestamp) {
        return new Message(id, conversationId, agentId, agentName, content, timestamp,
                Role.AGENT, Set.of(), false, null, false);
    }

    public Message withTopics(Set<TopicTag> newTopics) {
        return new Message(id, conversationId, senderId, senderName, content, timestamp,
                role, newTopics, isReply, repliedToId, hasImage);
    }

    public Message replyingTo(String quotedId) {
        return new Message(id, conversationId, senderId, senderName, content, timestamp,
                role, topics, quotedId != null, quotedId, hasImage);
    }

    public Message withImage() {
        return new Message(id, conversationId, senderId, senderName, content, timestamp,
                role, topics, isReply, repliedToId, true);
    }

    /**
     * An image analysis is an agent message that either carries the analysis prefix
     * or was recorded against an image.
     */
    public boolean isImageAnalysis() {
        return role == Role.AGENT && (content.startsWith(IMAGE_ANALYSIS_PREFIX) || hasImage);
    }

    /** Analysis text without the {@code [IMAGE ANALYSIS: ...]} wrapper. */
    public String imageAnalysisText() {
        if (!content.startsWith(IMAGE_ANALYSIS_PREFIX)) {
            return content.trim();
        }
        String body = content.substring(IMAGE_ANALYSIS_PREFIX.length());
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        return body.trim();
    }

    /** Sender name, or the sender id up to its {@code @} when no name is known. */
    public String senderLabel() {
        if (senderName != null && !senderName.isBlank()) {
            return senderName;
        }
        if (senderId == null) {
            return "someone";
        }
        int at = senderId.indexOf('@');
        return at > 0 ? senderId.substring(0, at) : senderId;
    }

    public boolean hasTopic(TopicTag tag) {
        return topics.contains(tag);
    }
}
