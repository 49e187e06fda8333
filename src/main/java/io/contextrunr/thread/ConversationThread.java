package io.contextrunr.thread;

import io.contextrunr.core.Message;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A contiguous run of messages judged to belong to one exchange.
 *
 * @param index    position of the thread within its segmentation, from 0
 * @param messages the messages, oldest first; never empty
 */
public record ConversationThread(int index, List<Message> messages) {

    public ConversationThread {
        messages = List.copyOf(messages);
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("A thread holds at least one message");
        }
    }

    public int size() {
        return messages.size();
    }

    public boolean hasQuestion() {
        return messages.stream().anyMatch(m -> m.content().contains("?"));
    }

    public boolean hasSender(String senderId) {
        return messages.stream().anyMatch(m -> m.senderId().equals(senderId));
    }

    /** Sender ids in order of first appearance. */
    public Set<String> senderIds() {
        Set<String> senders = new LinkedHashSet<>();
        messages.forEach(m -> senders.add(m.senderId()));
        return senders;
    }

    public Instant startedAt() {
        return messages.get(0).timestamp();
    }

    public Instant endedAt() {
        return messages.get(messages.size() - 1).timestamp();
    }
}
