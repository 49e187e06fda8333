package io.contextrunr.context;

import io.contextrunr.alias.ChatDirectory;
import io.contextrunr.config.AgentProperties;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import io.contextrunr.core.ParticipantState;
import io.contextrunr.memory.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides when the agent should introduce itself in a group chat.
 *
 * <p>The agent introduces itself in groups it has not seen before, in groups with fewer than
 * three messages, and in groups where it has been silent for more than a day. It never
 * introduces itself twice within a day.</p>
 */
@Component
public class IntroductionPolicy {

    private static final Logger log = LoggerFactory.getLogger(IntroductionPolicy.class);

    static final Duration REINTRODUCTION_INTERVAL = Duration.ofHours(24);
    static final int NEW_GROUP_MESSAGE_COUNT = 3;
    static final int GREETED_MEMBERS = 10;

    private final ConversationStore conversationStore;
    private final ChatDirectory chatDirectory;
    private final AgentProperties agent;
    private final Clock clock;

    public IntroductionPolicy(ConversationStore conversationStore, ChatDirectory chatDirectory,
                              AgentProperties agent, Clock clock) {
        this.conversationStore = conversationStore;
        this.chatDirectory = chatDirectory;
        this.agent = agent;
        this.clock = clock;
    }

    public boolean shouldIntroduce(String conversationId) {
        Optional<Conversation> found = conversationStore.getConversation(conversationId);
        if (found.isEmpty()) {
            return Conversation.Kind.fromConversationId(conversationId) == Conversation.Kind.GROUP;
        }

        Conversation conversation = found.get();
        if (!conversation.isGroup()) {
            return false;
        }

        Instant now = clock.instant();
        Optional<Instant> lastIntroduction = conversation.getLastIntroductionAt();
        if (conversation.hasIntroduced() && lastIntroduction.isPresent()
                && Duration.between(lastIntroduction.get(), now).compareTo(REINTRODUCTION_INTERVAL) < 0) {
            return false;
        }

        List<Message> messages = conversation.getMessages();
        if (messages.size() < NEW_GROUP_MESSAGE_COUNT) {
            return true;
        }

        Optional<Instant> lastSpoke = messages.stream()
                .filter(m -> agent.isAgent(m.senderId()))
                .map(Message::timestamp)
                .max(Comparator.naturalOrder());
        return lastSpoke.isEmpty() || Duration.between(lastSpoke.get(), now).compareTo(REINTRODUCTION_INTERVAL) > 0;
    }

    /** Greeting text naming the group's most recently active members. */
    public String introductionText(String conversationId) {
        String members = conversationStore.getConversation(conversationId)
                .map(this::recentMembers)
                .filter(names -> !names.isEmpty())
                .map(names -> String.join(", ", names))
                .orElse("everyone");

        return """
                Hi everyone! I'm %1$s, an AI assistant who can help out in this conversation.
                Nice to meet you, %2$s!

                You can chat with me casually, ask me questions, or just keep the group lively.
                Mention @%1$s or start your message with my name to talk to me."""
                .formatted(agent.name(), members);
    }

    /** Records that the introduction was sent. */
    public void markIntroduced(String conversationId) {
        conversationStore.markIntroduced(conversationId, clock.instant());
        conversationStore.getConversation(conversationId)
                .ifPresent(c -> log.info("Introduced {} in {}", agent.name(), chatDirectory.displayName(c)));
    }

    private List<String> recentMembers(Conversation conversation) {
        return conversation.getParticipants().values().stream()
                .filter(p -> !agent.isAgent(p.id()))
                .sorted(Comparator.comparing(ParticipantState::lastActiveAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(GREETED_MEMBERS)
                .map(ParticipantState::displayName)
                .toList();
    }
}
