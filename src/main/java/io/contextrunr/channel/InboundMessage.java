package io.contextrunr.channel;

import java.time.Instant;

/**
 * A message as delivered by a transport, before canonicalization.
 *
 * @param id              transport message id; generated when absent
 * @param senderId        sender participant id
 * @param senderName      sender display name, may be absent
 * @param text            message text
 * @param timestamp       send time; the current time when absent
 * @param quotedMessageId id of the quoted message, if the message is a reply
 * @param hasImage        whether the message carried an image or is an image analysis
 * @param chatName        group subject as reported by the transport, may be absent
 */
public record InboundMessage(
        String id,
        String senderId,
        String senderName,
        String text,
        Instant timestamp,
        String quotedMessageId,
        boolean hasImage,
        String chatName
) {
    public static InboundMessage text(String id, String senderId, String senderName, String text, Instant timestamp) {
        return new InboundMessage(id, senderId, senderName, text, timestamp, null, false, null);
    }
}
