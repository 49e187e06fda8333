package io.contextrunr.alias;

import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.Conversation;
import io.contextrunr.memory.ConversationStore;
import io.contextrunr.memory.GroupMetadata;
import io.contextrunr.memory.GroupMetadataLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fuzzy lookup of group conversations by name, scored like participant aliases.
 */
@Component
public class ChatDirectory {

    private static final Logger log = LoggerFactory.getLogger(ChatDirectory.class);

    private final ConversationStore conversationStore;
    private final GroupMetadataLookup groupMetadataLookup;
    private final AliasScorer scorer;
    private final int minAliasScore;

    public ChatDirectory(ConversationStore conversationStore, GroupMetadataLookup groupMetadataLookup,
                         AliasScorer scorer, ContextProperties properties) {
        this.conversationStore = conversationStore;
        this.groupMetadataLookup = groupMetadataLookup;
        this.scorer = scorer;
        this.minAliasScore = properties.minAliasScore();
    }

    /**
     * Resolves a chat name to group conversations.
     *
     * @param chatQuery a group name or part of one
     * @return matching groups, best first; equal scores keep conversation id order
     */
    public List<ChatCandidate> resolveChats(String chatQuery) {
        AliasQuery query = AliasQuery.parse(chatQuery);
        if (query.isEmpty()) {
            return List.of();
        }

        List<ChatCandidate> candidates = new ArrayList<>();
        for (Conversation conversation : conversationStore.listConversations()) {
            if (!conversation.isGroup()) continue;

            String name = displayName(conversation);
            Set<String> aliases = new LinkedHashSet<>();
            AliasDirectory.register(aliases, name);
            int score = scorer.score(query, conversation.getId(), aliases);
            if (score >= minAliasScore && score > 0) {
                candidates.add(new ChatCandidate(conversation.getId(), name, score));
            }
        }
        candidates.sort(Comparator.comparingInt(ChatCandidate::score).reversed());

        log.debug("Resolved chat '{}' to {} candidate(s)", query.normalized(), candidates.size());
        return List.copyOf(candidates);
    }

    public Optional<ChatCandidate> resolveBestChat(String chatQuery) {
        List<ChatCandidate> candidates = resolveChats(chatQuery);
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /** The label for a group: transport metadata when available, else the stored name. */
    public String displayName(Conversation conversation) {
        try {
            return groupMetadataLookup.describe(conversation.getId())
                    .map(GroupMetadata::displayName)
                    .filter(name -> !name.isBlank())
                    .orElse(conversation.getDisplayName());
        } catch (RuntimeException e) {
            log.warn("Group metadata lookup failed for {}: {}", conversation.getId(), e.getMessage());
            return conversation.getDisplayName();
        }
    }
}
