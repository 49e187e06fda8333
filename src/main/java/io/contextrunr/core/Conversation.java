package io.contextrunr.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A private or group conversation with its participants and an append-only message log.
 *
 * <p>Key behaviors:</p>
 * <ul>
 *   <li>Messages stay ordered by timestamp; a late append is placed after every message
 *       with an equal or earlier timestamp</li>
 *   <li>The log keeps at most {@code maxMessages} messages, oldest dropped first</li>
 *   <li>Participant state is updated on every message</li>
 *   <li>Clearing drops messages but keeps participants</li>
 * </ul>
 */
public class Conversation {

    private static final Logger log = LoggerFactory.getLogger(Conversation.class);
    private static final String GROUP_SUFFIX = "@g.us";

    public enum Kind {
        PRIVATE, GROUP;

        /** Group conversation ids carry the {@code @g.us} suffix. */
        public static Kind fromConversationId(String conversationId) {
            return conversationId != null && conversationId.endsWith(GROUP_SUFFIX) ? GROUP : PRIVATE;
        }
    }

    private final String id;
    private final Kind kind;
    private final int maxMessages;
    private final Map<String, ParticipantState> participants = new LinkedHashMap<>();
    private final List<Message> messages = new ArrayList<>();

    private String displayName;
    private Instant lastActiveAt;
    private boolean hasIntroduced;
    private Instant lastIntroductionAt;

    public Conversation(String id, Kind kind, int maxMessages) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.maxMessages = maxMessages;
        this.displayName = kind == Kind.GROUP ? "Group Chat" : "Private Chat";
    }

    public String getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isGroup() {
        return kind == Kind.GROUP;
    }

    public synchronized String getDisplayName() {
        return displayName;
    }

    public synchronized void setDisplayName(String displayName) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName.trim();
        }
    }

    public synchronized Instant getLastActiveAt() {
        return lastActiveAt;
    }

    public synchronized boolean hasIntroduced() {
        return hasIntroduced;
    }

    public synchronized Optional<Instant> getLastIntroductionAt() {
        return Optional.ofNullable(lastIntroductionAt);
    }

    public synchronized void markIntroduced(Instant at) {
        this.hasIntroduced = true;
        this.lastIntroductionAt = at;
    }

    /**
     * Appends a message, updates the sender's participant state and trims the log
     * to the retention limit.
     */
    public synchronized void append(Message message) {
        if (!id.equals(message.conversationId())) {
            throw new IllegalArgumentException(
                    "Message " + message.id() + " belongs to " + message.conversationId() + ", not " + id);
        }

        int insertAt = messages.size();
        while (insertAt > 0 && messages.get(insertAt - 1).timestamp().isAfter(message.timestamp())) {
            insertAt--;
        }
        messages.add(insertAt, message);

        participants.compute(message.senderId(), (senderId, state) -> state == null
                ? ParticipantState.firstMessage(senderId, message.senderLabel(), message.content(), message.timestamp())
                : state.recordMessage(message.senderName(), message.content(), message.timestamp()));

        if (lastActiveAt == null || message.timestamp().isAfter(lastActiveAt)) {
            lastActiveAt = message.timestamp();
        }
        trimToRetention();
    }

    /** Returns an immutable copy of the ordered message log. */
    public synchronized List<Message> getMessages() {
        return List.copyOf(messages);
    }

    /** Returns the most recent {@code limit} messages, oldest first. */
    public synchronized List<Message> recentMessages(int limit) {
        if (limit <= 0) return List.of();
        int from = Math.max(0, messages.size() - limit);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized boolean isEmpty() {
        return messages.isEmpty();
    }

    /** Index of the message with the given id, or -1. */
    public synchronized int indexOf(String messageId) {
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).id().equals(messageId)) {
                return i;
            }
        }
        return -1;
    }

    /** Messages from {@code index - before} to {@code index + after}, clamped to the log. */
    public synchronized List<Message> window(int index, int before, int after) {
        if (index < 0 || index >= messages.size()) return List.of();
        int from = Math.max(0, index - before);
        int to = Math.min(messages.size(), index + after + 1);
        return List.copyOf(messages.subList(from, to));
    }

    public synchronized Map<String, ParticipantState> getParticipants() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(participants));
    }

    public synchronized Optional<ParticipantState> getParticipant(String participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public synchronized boolean hasParticipant(String participantId) {
        return participants.containsKey(participantId);
    }

    /**
     * The participant with the most messages, excluding {@code excludedId}.
     * Ties go to the most recently active participant, then to the lower id.
     */
    public synchronized Optional<ParticipantState> mostActiveParticipant(String excludedId) {
        return participants.values().stream()
                .filter(p -> !p.id().equals(excludedId))
                .min(Comparator.comparingInt(ParticipantState::messageCount).reversed()
                        .thenComparing(ParticipantState::lastActiveAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(ParticipantState::id));
    }

    /** Drops every message; participants and introduction state are kept. */
    public synchronized void clearMessages() {
        log.debug("Clearing {} messages from conversation {}", messages.size(), id);
        messages.clear();
    }

    private void trimToRetention() {
        int dropCount = messages.size() - maxMessages;
        if (maxMessages <= 0 || dropCount <= 0) {
            return;
        }
        messages.subList(0, dropCount).clear();
        log.debug("Trimmed conversation {}: dropped {} oldest messages, kept {}", id, dropCount, messages.size());
    }
}
