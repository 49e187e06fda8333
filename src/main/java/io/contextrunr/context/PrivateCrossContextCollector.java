package io.contextrunr.context;

import io.contextrunr.config.AgentProperties;
import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import io.contextrunr.core.ParticipantState;
import io.contextrunr.memory.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * For group chats, pulls the latest messages of the agent's private chats with the group's members.
 */
@Component
public class PrivateCrossContextCollector {

    private static final Logger log = LoggerFactory.getLogger(PrivateCrossContextCollector.class);
    static final String SOURCE = "private-context";
    static final int MESSAGES_PER_CHAT = 3;

    private final ConversationStore conversationStore;
    private final ContextProperties properties;
    private final AgentProperties agent;

    public PrivateCrossContextCollector(ConversationStore conversationStore, ContextProperties properties,
                                        AgentProperties agent) {
        this.conversationStore = conversationStore;
        this.properties = properties;
        this.agent = agent;
    }

    public Optional<ContextEntry> collect(Conversation group, Instant now) {
        if (!group.isGroup() || !properties.privateCrossContextEnabled() || properties.maxCrossChatMessages() == 0) {
            return Optional.empty();
        }

        record Line(Message message, String text) {}
        Map<String, Line> lines = new LinkedHashMap<>();
        for (String participantId : group.getParticipants().keySet()) {
            if (agent.isAgent(participantId)) continue;

            for (Conversation chat : conversationStore.listConversations()) {
                if (chat.isGroup() || chat.getId().equals(group.getId()) || !chat.hasParticipant(participantId)) {
                    continue;
                }
                String partner = chat.getParticipant(participantId).map(ParticipantState::displayName).orElse(participantId);
                for (Message message : chat.recentMessages(MESSAGES_PER_CHAT)) {
                    String sender = agent.isAgent(message.senderId()) ? agent.name() : message.senderLabel();
                    lines.putIfAbsent(message.id(), new Line(message,
                            "[From private chat with %s] %s: %s".formatted(partner, sender,
                                    CrossChatExcerptCollector.truncate(message.content()))));
                }
            }
        }
        if (lines.isEmpty()) {
            return Optional.empty();
        }

        List<Line> newestFirst = new ArrayList<>(lines.values());
        newestFirst.sort(Comparator.comparing((Line l) -> l.message().timestamp()).reversed());

        StringJoiner content = new StringJoiner("\n");
        content.add("Relevant notes from private chats:");
        newestFirst.stream().limit(properties.maxCrossChatMessages()).forEach(l -> content.add(l.text()));
        log.debug("Added {} private-chat line(s) to group {}", Math.min(newestFirst.size(),
                properties.maxCrossChatMessages()), group.getId());
        return Optional.of(ContextEntry.system(content.toString(), SOURCE, ContextEntry.PRIORITY_CROSS_CHAT, now));
    }
}
