package io.contextrunr.context;

import io.contextrunr.alias.AliasCandidate;
import io.contextrunr.alias.AliasDirectory;
import io.contextrunr.alias.ChatCandidate;
import io.contextrunr.alias.ChatDirectory;
import io.contextrunr.classify.CrossChatIntent;
import io.contextrunr.config.AgentProperties;
import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import io.contextrunr.core.ParticipantState;
import io.contextrunr.memory.ConversationStore;
import io.contextrunr.thread.ConversationThread;
import io.contextrunr.thread.ScoredThread;
import io.contextrunr.thread.ThreadRanker;
import io.contextrunr.thread.ThreadRankingContext;
import io.contextrunr.thread.ThreadSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Collects excerpts from other conversations for a cross-chat question.
 *
 * <ul>
 *   <li>MOOD: the agent's recent messages elsewhere, each with the message that triggered it</li>
 *   <li>CONVERSATION: recent exchanges with the named person in conversations they share with the agent</li>
 *   <li>GROUP_ACTIVITY: the highest-ranked threads of the named group, or of every other group</li>
 * </ul>
 *
 * <p>Every line carries its provenance ({@code In <chat>: <name> said: <text>}). The block holds
 * at most {@code context.max-cross-chat-messages} lines.</p>
 */
@Component
public class CrossChatExcerptCollector {

    private static final Logger log = LoggerFactory.getLogger(CrossChatExcerptCollector.class);
    static final String SOURCE = "cross-chat";
    static final int MAX_LINE_LENGTH = 200;
    private static final int ACTIVE_SENDER_COUNT = 3;

    private final ConversationStore conversationStore;
    private final AliasDirectory aliasDirectory;
    private final ChatDirectory chatDirectory;
    private final ThreadSegmenter segmenter;
    private final ThreadRanker ranker;
    private final ContextProperties properties;
    private final AgentProperties agent;

    public CrossChatExcerptCollector(ConversationStore conversationStore, AliasDirectory aliasDirectory,
                                     ChatDirectory chatDirectory, ThreadSegmenter segmenter, ThreadRanker ranker,
                                     ContextProperties properties, AgentProperties agent) {
        this.conversationStore = conversationStore;
        this.aliasDirectory = aliasDirectory;
        this.chatDirectory = chatDirectory;
        this.segmenter = segmenter;
        this.ranker = ranker;
        this.properties = properties;
        this.agent = agent;
    }

    /** A provenance line with the time it refers to. */
    record Excerpt(Instant at, String line) {}

    /**
     * Builds the cross-chat block for an intent.
     *
     * @param intent  the classified intent
     * @param current the conversation the question was asked in
     * @param now     assembly time
     * @return one system entry, or empty if the intent is not cross-chat or nothing was found
     */
    public Optional<ContextEntry> collect(CrossChatIntent intent, Conversation current, Instant now) {
        if (!intent.isCrossChatQuestion()) {
            return Optional.empty();
        }

        List<String> lines = switch (intent.type()) {
            case MOOD -> moodExcerpts(intent, current);
            case CONVERSATION -> conversationExcerpts(intent, current);
            case GROUP_ACTIVITY -> groupExcerpts(intent, current);
            case NONE -> List.of();
        };
        if (lines.isEmpty()) {
            log.debug("No cross-chat excerpts for {} intent in {}", intent.type(), current.getId());
            return Optional.empty();
        }

        StringJoiner content = new StringJoiner("\n");
        content.add("Context from other chats:");
        lines.forEach(content::add);
        log.debug("Collected {} cross-chat line(s) for {} intent", lines.size(), intent.type());
        return Optional.of(ContextEntry.system(content.toString(), SOURCE, ContextEntry.PRIORITY_CROSS_CHAT, now));
    }

    private List<String> moodExcerpts(CrossChatIntent intent, Conversation current) {
        List<Conversation> scanned = intent.chat()
                .flatMap(chatDirectory::resolveBestChat)
                .flatMap(candidate -> conversationStore.getConversation(candidate.conversationId()))
                .map(List::of)
                .orElseGet(() -> otherConversations(current));

        List<Excerpt> excerpts = new ArrayList<>();
        for (Conversation conversation : scanned) {
            String chat = chatLabel(conversation);
            List<Message> messages = conversation.recentMessages(properties.maxRelevantMessages());
            for (int i = 0; i < messages.size(); i++) {
                Message message = messages.get(i);
                if (!agent.isAgent(message.senderId())) continue;
                trigger(messages, i).ifPresent(t -> excerpts.add(line(chat, t)));
                excerpts.add(line(chat, message));
            }
        }
        return newestInOrder(excerpts);
    }

    private List<String> conversationExcerpts(CrossChatIntent intent, Conversation current) {
        Optional<AliasCandidate> person = intent.target().flatMap(name ->
                aliasDirectory.resolveCandidates(name).stream()
                        .filter(c -> !agent.isAgent(c.participantId()))
                        .findFirst());
        if (person.isEmpty()) {
            log.debug("Cross-chat target '{}' did not resolve to a participant", intent.targetName());
            return List.of();
        }

        String personId = person.get().participantId();
        List<Excerpt> excerpts = new ArrayList<>();
        for (Conversation conversation : otherConversations(current)) {
            if (!conversation.hasParticipant(personId)) continue;
            String chat = chatLabel(conversation);
            for (Message message : conversation.recentMessages(properties.maxRelevantMessages())) {
                if (message.senderId().equals(personId) || agent.isAgent(message.senderId())) {
                    excerpts.add(line(chat, message));
                }
            }
        }
        return newestInOrder(excerpts);
    }

    private List<String> groupExcerpts(CrossChatIntent intent, Conversation current) {
        List<Conversation> groups;
        Optional<ChatCandidate> named = intent.chat().flatMap(chatDirectory::resolveBestChat);
        if (named.isPresent()) {
            groups = conversationStore.getConversation(named.get().conversationId()).map(List::of).orElse(List.of());
        } else {
            groups = otherConversations(current).stream()
                    .filter(Conversation::isGroup)
                    .sorted(Comparator.comparing(Conversation::getLastActiveAt,
                            Comparator.nullsLast(Comparator.reverseOrder())))
                    .toList();
        }

        List<String> lines = new ArrayList<>();
        for (Conversation group : groups) {
            if (lines.size() >= properties.maxCrossChatMessages()) break;
            String chat = chatLabel(group);
            List<Message> messages = group.recentMessages(properties.maxRelevantMessages());
            if (messages.isEmpty()) {
                lines.add("In %s: no recent activity.".formatted(chat));
                continue;
            }

            var context = new ThreadRankingContext(agent.id(),
                    ThreadRanker.topSenders(messages, ACTIVE_SENDER_COUNT), properties.threadTopK());
            List<ConversationThread> chosen = ranker.rankThreads(segmenter.segmentThreads(messages), context).stream()
                    .map(ScoredThread::thread)
                    .sorted(Comparator.comparingInt(ConversationThread::index))
                    .toList();
            for (ConversationThread thread : chosen) {
                for (Message message : thread.messages()) {
                    if (lines.size() >= properties.maxCrossChatMessages()) break;
                    lines.add(line(chat, message).line());
                }
            }
        }
        return lines;
    }

    /** Most recent excerpts up to the line cap, presented oldest first. */
    private List<String> newestInOrder(List<Excerpt> excerpts) {
        List<Excerpt> sorted = new ArrayList<>(excerpts);
        sorted.sort(Comparator.comparing(Excerpt::at));
        int from = Math.max(0, sorted.size() - properties.maxCrossChatMessages());
        return sorted.subList(from, sorted.size()).stream().map(Excerpt::line).toList();
    }

    private List<Conversation> otherConversations(Conversation current) {
        return conversationStore.listConversations().stream()
                .filter(c -> !c.getId().equals(current.getId()))
                .toList();
    }

    /** The message right before an agent message, when someone else sent it. */
    private Optional<Message> trigger(List<Message> messages, int agentIndex) {
        if (agentIndex == 0) {
            return Optional.empty();
        }
        Message previous = messages.get(agentIndex - 1);
        return agent.isAgent(previous.senderId()) ? Optional.empty() : Optional.of(previous);
    }

    private Excerpt line(String chat, Message message) {
        String name = agent.isAgent(message.senderId()) ? agent.name() : message.senderLabel();
        return new Excerpt(message.timestamp(),
                "In %s: %s said: %s".formatted(chat, name, truncate(message.content())));
    }

    String chatLabel(Conversation conversation) {
        if (conversation.isGroup()) {
            return chatDirectory.displayName(conversation);
        }
        return conversation.getParticipants().values().stream()
                .filter(p -> !agent.isAgent(p.id()))
                .findFirst()
                .map(ParticipantState::displayName)
                .map(name -> "private chat with " + name)
                .orElse(conversation.getDisplayName());
    }

    static String truncate(String text) {
        String flat = text.replace('\n', ' ').trim();
        return flat.length() > MAX_LINE_LENGTH ? flat.substring(0, MAX_LINE_LENGTH) + "..." : flat;
    }
}
