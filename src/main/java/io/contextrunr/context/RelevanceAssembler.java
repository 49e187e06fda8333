package io.contextrunr.context;

import io.contextrunr.classify.CrossChatIntent;
import io.contextrunr.classify.CrossChatIntentClassifier;
import io.contextrunr.classify.TopicClassifier;
import io.contextrunr.classify.TopicTag;
import io.contextrunr.config.AgentProperties;
import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.ContextWindow;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import io.contextrunr.core.ParticipantState;
import io.contextrunr.memory.ConversationStore;
import io.contextrunr.memory.Fact;
import io.contextrunr.memory.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * Builds the context window handed to the response generator for an inbound message.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Chat header describing the current chat</li>
 *   <li>The last {@code max-relevant-messages} messages of the conversation</li>
 *   <li>Older messages sharing a topic with the query</li>
 *   <li>Messages around the quoted message, if the query is a reply</li>
 *   <li>Merge, sort by time and keep the most recent</li>
 *   <li>Excerpts from other chats for cross-chat questions, plus private-chat notes in groups</li>
 *   <li>Analysis of a previously shared image the query refers to</li>
 *   <li>Confident facts about the most active participant, most relevant to the query first; in
 *       groups also the query-relevant facts of other members</li>
 * </ol>
 * <p>Entries are finally ordered by priority. A failing collaborator in the injected steps is
 * logged and recorded on the window; it never aborts assembly.</p>
 */
@Component
public class RelevanceAssembler {

    private static final Logger log = LoggerFactory.getLogger(RelevanceAssembler.class);

    static final String STEP_CHAT_HEADER = "chat-header";
    static final String STEP_CROSS_CHAT = "cross-chat";
    static final String STEP_PRIVATE_CONTEXT = "private-context";
    static final String STEP_IMAGE = "image";
    static final String STEP_FACTS = "facts";

    static final String SOURCE_FACTS = "facts";
    static final int REPLY_WINDOW = 2;
    static final int MAX_SUBJECT_FACTS = 10;
    static final int MAX_OTHER_MEMBER_FACTS = 3;
    static final double OTHER_MEMBER_CONFIDENCE = 0.8;

    private final ConversationStore conversationStore;
    private final FactStore factStore;
    private final TopicClassifier topicClassifier;
    private final CrossChatIntentClassifier intentClassifier;
    private final CrossChatExcerptCollector crossChatCollector;
    private final PrivateCrossContextCollector privateContextCollector;
    private final ImageContextBuilder imageContextBuilder;
    private final ChatHeaderBuilder chatHeaderBuilder;
    private final FactSelector factSelector;
    private final ContextProperties properties;
    private final AgentProperties agent;
    private final Clock clock;

    public RelevanceAssembler(ConversationStore conversationStore, FactStore factStore,
                              TopicClassifier topicClassifier, CrossChatIntentClassifier intentClassifier,
                              CrossChatExcerptCollector crossChatCollector,
                              PrivateCrossContextCollector privateContextCollector,
                              ImageContextBuilder imageContextBuilder, ChatHeaderBuilder chatHeaderBuilder,
                              FactSelector factSelector, ContextProperties properties, AgentProperties agent, Clock clock) {
        this.conversationStore = conversationStore;
        this.factStore = factStore;
        this.topicClassifier = topicClassifier;
        this.intentClassifier = intentClassifier;
        this.crossChatCollector = crossChatCollector;
        this.privateContextCollector = privateContextCollector;
        this.imageContextBuilder = imageContextBuilder;
        this.chatHeaderBuilder = chatHeaderBuilder;
        this.factSelector = factSelector;
        this.properties = properties;
        this.agent = agent;
        this.clock = clock;
    }

    /**
     * Builds the context window for a query.
     *
     * @param query          the inbound message
     * @param conversationId the conversation it was sent in
     * @return the window; empty when the conversation is unknown
     */
    public ContextWindow buildContext(Message query, String conversationId) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(conversationId, "conversationId");

        Optional<Conversation> found = conversationStore.getConversation(conversationId);
        if (found.isEmpty()) {
            log.debug("No conversation {}, returning empty context", conversationId);
            return ContextWindow.empty();
        }
        Conversation conversation = found.get();
        Instant now = clock.instant();

        List<ContextEntry> entries = new ArrayList<>();
        List<String> degraded = new ArrayList<>();

        runStep(STEP_CHAT_HEADER, () -> chatHeaderBuilder.build(conversation, now), entries, degraded);

        List<Message> relevant = relevantMessages(query, conversation);
        relevant.forEach(m -> entries.add(ContextEntry.fromMessage(m)));

        runStep(STEP_CROSS_CHAT, () -> {
            CrossChatIntent intent = intentClassifier.classifyCrossChatIntent(query.content(), agent.name());
            return crossChatCollector.collect(intent, conversation, now).map(List::of).orElse(List.of());
        }, entries, degraded);

        if (conversation.isGroup()) {
            runStep(STEP_PRIVATE_CONTEXT, () -> privateContextCollector.collect(conversation, now)
                    .map(List::of).orElse(List.of()), entries, degraded);
        }

        runStep(STEP_IMAGE, () -> imageContextBuilder.build(query, conversation, now)
                .map(List::of).orElse(List.of()), entries, degraded);

        runStep(STEP_FACTS, () -> factEntry(query, conversation, now).map(List::of).orElse(List.of()),
                entries, degraded);

        entries.sort(Comparator.comparingInt(ContextEntry::priority));

        log.debug("Built context for {}: {} conversation + {} injected entries, degraded={}",
                conversationId, relevant.size(), entries.size() - relevant.size(), degraded);
        return new ContextWindow(entries, degraded);
    }

    /** Steps 2-5: recent, topic-matched and reply-window messages, deduplicated and bounded. */
    List<Message> relevantMessages(Message query, Conversation conversation) {
        int limit = properties.maxRelevantMessages();
        List<Message> all = conversation.getMessages();
        Map<String, Message> merged = new LinkedHashMap<>();

        List<Message> recent = conversation.recentMessages(limit);
        recent.forEach(m -> merged.putIfAbsent(m.id(), m));

        Set<TopicTag> topics = topicClassifier.classifyTopics(query.content());
        int perTag = properties.topicMessagesPerTag();
        for (TopicTag tag : topics) {
            lastTagged(all, tag, perTag).forEach(m -> merged.putIfAbsent(m.id(), m));
        }

        if (query.isReply() && query.repliedToId() != null) {
            int index = conversation.indexOf(query.repliedToId());
            conversation.window(index, REPLY_WINDOW, REPLY_WINDOW).forEach(m -> merged.putIfAbsent(m.id(), m));
        }

        List<Message> ordered = new ArrayList<>(merged.values());
        ordered.sort(Comparator.comparing(Message::timestamp));
        if (ordered.size() > limit) {
            ordered = ordered.subList(ordered.size() - limit, ordered.size());
        }
        log.debug("Relevant messages for {}: {} recent, {} topic(s), {} kept",
                conversation.getId(), recent.size(), topics.size(), ordered.size());
        return List.copyOf(ordered);
    }

    private static List<Message> lastTagged(List<Message> messages, TopicTag tag, int limit) {
        List<Message> tagged = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0 && tagged.size() < limit; i--) {
            if (messages.get(i).hasTopic(tag)) {
                tagged.add(0, messages.get(i));
            }
        }
        return tagged;
    }

    private Optional<ContextEntry> factEntry(Message query, Conversation conversation, Instant now) {
        Optional<ParticipantState> subject = conversation.mostActiveParticipant(agent.id());
        if (subject.isEmpty()) {
            return Optional.empty();
        }

        double threshold = properties.factConfidenceThreshold();
        Set<String> keywords = factSelector.keywords(query.content());
        List<Fact> confident = factStore.getFacts(subject.get().id()).values().stream()
                .filter(f -> f.isAtLeast(threshold))
                .toList();
        List<Fact> subjectFacts = factSelector.rank(confident, keywords, MAX_SUBJECT_FACTS);
        List<MemberFact> memberFacts = conversation.isGroup()
                ? otherMemberFacts(conversation, subject.get().id(), keywords, threshold)
                : List.of();
        if (subjectFacts.isEmpty() && memberFacts.isEmpty()) {
            return Optional.empty();
        }

        StringJoiner content = new StringJoiner("\n");
        if (!subjectFacts.isEmpty()) {
            content.add("Known facts about " + subject.get().displayName() + ":");
            for (Fact fact : subjectFacts) {
                content.add("- %s: %s".formatted(fact.key().replace('_', ' '), fact.value()));
            }
        }
        if (!memberFacts.isEmpty()) {
            content.add("Facts about other members related to this message:");
            for (MemberFact member : memberFacts) {
                content.add("- %s, %s: %s".formatted(member.name(), member.fact().key().replace('_', ' '),
                        member.fact().value()));
            }
        }
        return Optional.of(ContextEntry.system(content.toString(), SOURCE_FACTS, ContextEntry.PRIORITY_FACTS, now));
    }

    private record MemberFact(String name, Fact fact, int relevance) {}

    /** High-confidence facts of the other group members that match the query, best first. */
    private List<MemberFact> otherMemberFacts(Conversation group, String subjectId, Set<String> keywords,
                                              double threshold) {
        if (keywords.isEmpty()) {
            return List.of();
        }
        double minConfidence = Math.max(threshold, OTHER_MEMBER_CONFIDENCE);
        List<MemberFact> matches = new ArrayList<>();
        for (ParticipantState member : group.getParticipants().values()) {
            if (member.id().equals(subjectId) || agent.isAgent(member.id())) continue;

            for (Fact fact : factStore.getFacts(member.id()).values()) {
                int relevance = factSelector.relevance(fact, keywords);
                if (relevance > 0 && fact.isAtLeast(minConfidence)) {
                    matches.add(new MemberFact(member.displayName(), fact, relevance));
                }
            }
        }
        matches.sort(Comparator.comparingInt(MemberFact::relevance).reversed());
        return matches.stream().limit(MAX_OTHER_MEMBER_FACTS).toList();
    }

    private static void runStep(String step, Supplier<List<ContextEntry>> contribution,
                                List<ContextEntry> entries, List<String> degraded) {
        try {
            entries.addAll(contribution.get());
        } catch (RuntimeException e) {
            log.warn("Context step '{}' failed, continuing without it: {}", step, e.getMessage());
            degraded.add(step);
        }
    }
}
