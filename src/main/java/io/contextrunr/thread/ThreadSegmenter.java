package io.contextrunr.thread;

import io.contextrunr.core.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a message sequence into threads.
 *
 * <p>A message opens a new thread when its sender differs from the previous message's, when it
 * starts with a topic-shift connective ("btw", "ngomong-ngomong", "oh iya", ...), when it
 * contains a question mark, or when the open thread is full.</p>
 */
@Component
public class ThreadSegmenter {

    public static final int MAX_THREAD_SIZE = 5;

    static final Pattern TOPIC_SHIFT = Pattern.compile(
            "^(?:btw|by the way|ngomong-ngomong|ngomong|omong-omong|anyway|oh iya|oiya)\\b");

    public List<ConversationThread> segmentThreads(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }

        List<ConversationThread> threads = new ArrayList<>();
        List<Message> open = new ArrayList<>();

        for (Message message : messages) {
            if (!open.isEmpty() && startsNewThread(open, message)) {
                threads.add(new ConversationThread(threads.size(), open));
                open = new ArrayList<>();
            }
            open.add(message);
        }
        threads.add(new ConversationThread(threads.size(), open));
        return List.copyOf(threads);
    }

    private static boolean startsNewThread(List<Message> open, Message next) {
        Message previous = open.get(open.size() - 1);
        if (!previous.senderId().equals(next.senderId())) return true;
        if (open.size() >= MAX_THREAD_SIZE) return true;
        if (next.content().contains("?")) return true;
        return TOPIC_SHIFT.matcher(next.content().trim().toLowerCase(Locale.ROOT)).find();
    }
}
