package io.contextrunr.context;

import io.contextrunr.alias.ChatDirectory;
import io.contextrunr.config.AgentProperties;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.ParticipantState;
import io.contextrunr.memory.ConversationStore;
import io.contextrunr.memory.GroupMetadata;
import io.contextrunr.memory.GroupMetadataLookup;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Describes the current chat: group name, size and active members, or the private-chat
 * partner and the groups they share with the agent.
 */
@Component
public class ChatHeaderBuilder {

    static final String SOURCE = "chat-header";
    static final int MAX_ACTIVE_MEMBERS = 10;
    static final int MAX_SHARED_GROUPS = 3;

    private final ConversationStore conversationStore;
    private final ChatDirectory chatDirectory;
    private final GroupMetadataLookup groupMetadataLookup;
    private final AgentProperties agent;

    public ChatHeaderBuilder(ConversationStore conversationStore, ChatDirectory chatDirectory,
                             GroupMetadataLookup groupMetadataLookup, AgentProperties agent) {
        this.conversationStore = conversationStore;
        this.chatDirectory = chatDirectory;
        this.groupMetadataLookup = groupMetadataLookup;
        this.agent = agent;
    }

    /**
     * @return zero to two header entries
     */
    public List<ContextEntry> build(Conversation conversation, Instant now) {
        List<String> lines = conversation.isGroup() ? groupLines(conversation) : privateLines(conversation);
        List<ContextEntry> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            entries.add(ContextEntry.system(line, SOURCE, ContextEntry.PRIORITY_CHAT_HEADER, now));
        }
        return entries;
    }

    private List<String> groupLines(Conversation group) {
        String name = chatDirectory.displayName(group);
        int memberCount = groupMetadataLookup.describe(group.getId())
                .map(GroupMetadata::memberCount)
                .filter(count -> count > 0)
                .orElse(group.getParticipants().size());

        List<String> active = group.getParticipants().values().stream()
                .filter(p -> !agent.isAgent(p.id()))
                .sorted(Comparator.comparing(ParticipantState::lastActiveAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(MAX_ACTIVE_MEMBERS)
                .map(ParticipantState::displayName)
                .toList();

        if (active.isEmpty()) {
            return List.of("This is the group chat \"%s\" with %d members.".formatted(name, memberCount));
        }
        return List.of("This is the group chat \"%s\" with %d members, including %s."
                .formatted(name, memberCount, String.join(", ", active)));
    }

    private List<String> privateLines(Conversation conversation) {
        Optional<ParticipantState> partner = conversation.getParticipants().values().stream()
                .filter(p -> !agent.isAgent(p.id()))
                .findFirst();
        if (partner.isEmpty()) {
            return List.of();
        }

        ParticipantState person = partner.get();
        List<String> lines = new ArrayList<>();
        lines.add("This is a private chat with %s, who has sent %d messages."
                .formatted(person.displayName(), person.messageCount()));

        List<String> groups = conversationStore.listConversations().stream()
                .filter(Conversation::isGroup)
                .filter(c -> !c.getId().equals(conversation.getId()))
                .filter(c -> c.hasParticipant(person.id()))
                .limit(MAX_SHARED_GROUPS)
                .map(chatDirectory::displayName)
                .toList();
        if (!groups.isEmpty()) {
            lines.add("%s is also in groups: %s".formatted(person.displayName(), String.join(", ", groups)));
        }
        return lines;
    }
}
