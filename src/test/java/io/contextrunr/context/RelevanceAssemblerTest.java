package io.contextrunr.context;

import io.contextrunr.alias.AliasDirectory;
import io.contextrunr.alias.AliasScorer;
import io.contextrunr.alias.ChatDirectory;
import io.contextrunr.classify.CrossChatIntentClassifier;
import io.contextrunr.classify.TopicClassifier;
import io.contextrunr.config.AgentProperties;
import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.ContextWindow;
import io.contextrunr.core.Message;
import io.contextrunr.memory.Fact;
import io.contextrunr.memory.FactStore;
import io.contextrunr.memory.FactStoreException;
import io.contextrunr.memory.InMemoryConversationStore;
import io.contextrunr.memory.StoreGroupMetadataLookup;
import io.contextrunr.thread.ThreadRanker;
import io.contextrunr.thread.ThreadSegmenter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RelevanceAssemblerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant NOW = T0.plusSeconds(7200);
    private static final AgentProperties AGENT = new AgentProperties("agent", "Qi");

    private static final String BUDI = "U1@s.whatsapp.net";
    private static final String KANTOR = "kantor@g.us";

    private final TopicClassifier topicClassifier = new TopicClassifier();

    private InMemoryConversationStore store;
    private Map<String, Map<String, Fact>> facts;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore(ContextProperties.defaults());
        facts = new HashMap<>();
    }

    private RelevanceAssembler assembler(ContextProperties properties, FactStore factStore,
                                         ImageSimilarityLookup imageLookup) {
        AliasScorer scorer = new AliasScorer();
        StoreGroupMetadataLookup metadata = new StoreGroupMetadataLookup(store);
        ChatDirectory chats = new ChatDirectory(store, metadata, scorer, properties);
        AliasDirectory aliases = new AliasDirectory(store, factStore, scorer, properties);
        return new RelevanceAssembler(store, factStore, topicClassifier, new CrossChatIntentClassifier(),
                new CrossChatExcerptCollector(store, aliases, chats, new ThreadSegmenter(), new ThreadRanker(),
                        properties, AGENT),
                new PrivateCrossContextCollector(store, properties, AGENT),
                new ImageContextBuilder(new ImageReferenceDetector(), Optional.ofNullable(imageLookup), properties),
                new ChatHeaderBuilder(store, chats, metadata, AGENT), new FactSelector(),
                properties, AGENT, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private RelevanceAssembler assembler(ContextProperties properties) {
        return assembler(properties, id -> facts.getOrDefault(id, Map.of()), null);
    }

    private RelevanceAssembler assembler() {
        return assembler(ContextProperties.defaults());
    }

    private void add(String conversationId, String id, String senderId, String senderName, String text, Instant at) {
        Message message = senderId.equals(AGENT.id())
                ? Message.agent(id, conversationId, senderId, senderName, text, at)
                : Message.user(id, conversationId, senderId, senderName, text, at);
        store.appendMessage(conversationId, message.withTopics(topicClassifier.classifyTopics(text)));
    }

    private void fillPrivateChat(int count) {
        for (int i = 0; i < count; i++) {
            add(BUDI, "m" + i, "U1", "Budi", "pesan " + i, T0.plusSeconds(60L * i));
        }
    }

    private static Message query(String conversationId, String text) {
        return Message.user("q", conversationId, "U1", "Budi", text, NOW);
    }

    private void fact(String subjectId, String key, String value, double confidence) {
        facts.computeIfAbsent(subjectId, id -> new HashMap<>())
                .put(key, new Fact(subjectId, key, value, confidence, null, T0));
    }

    private static List<String> conversationIds(ContextWindow window) {
        return window.conversationEntries().stream().map(ContextEntry::messageId).toList();
    }

    @Test
    void shouldKeepMostRecentMessagesAsBase() {
        fillPrivateChat(25);

        ContextWindow window = assembler(ContextProperties.defaults().withMaxRelevantMessages(20))
                .buildContext(query(BUDI, "ok"), BUDI);

        assertEquals(IntStream.range(5, 25).mapToObj(i -> "m" + i).toList(), conversationIds(window));
        assertEquals("Budi: pesan 24", window.conversationEntries().get(19).content());
        assertFalse(window.isDegraded());
    }

    @Test
    void shouldTruncateTopicMatchesByRecency() {
        add(BUDI, "old-food", "U1", "Budi", "makan bakso enak", T0);
        for (int i = 1; i <= 10; i++) {
            add(BUDI, "m" + i, "U1", "Budi", "pesan " + i, T0.plusSeconds(60L * i));
        }

        ContextWindow window = assembler(ContextProperties.defaults().withMaxRelevantMessages(5))
                .buildContext(query(BUDI, "mau makan apa"), BUDI);

        assertEquals(List.of("m6", "m7", "m8", "m9", "m10"), conversationIds(window));
    }

    @Test
    void shouldIncludeTopicMatchesWithinBudget() {
        add(BUDI, "old-food", "U1", "Budi", "makan bakso enak", T0);
        add(BUDI, "m1", "U1", "Budi", "pesan 1", T0.plusSeconds(60));

        ContextWindow window = assembler().buildContext(query(BUDI, "mau makan apa"), BUDI);

        assertEquals(List.of("old-food", "m1"), conversationIds(window));
    }

    @Test
    void shouldNotDuplicateRepliedMessages() {
        fillPrivateChat(25);
        Message reply = query(BUDI, "setuju").replyingTo("m22");

        ContextWindow window = assembler().buildContext(reply, BUDI);

        List<String> ids = conversationIds(window);
        assertEquals(20, ids.size());
        assertEquals(ids.size(), new HashSet<>(ids).size());
    }

    @Test
    void shouldIncludeOnlyConfidentFacts() {
        fillPrivateChat(3);
        fact("U1", "location", "Bandung", 0.9);
        fact("U1", "favorite_food", "bakso", 0.75);
        fact("U1", "hobby", "mancing", 0.7);

        List<ContextEntry> factEntries = assembler().buildContext(query(BUDI, "halo"), BUDI).entriesFrom("facts");

        assertEquals(1, factEntries.size());
        assertEquals("""
                Known facts about Budi:
                - favorite food: bakso
                - location: Bandung""", factEntries.get(0).content());
        assertEquals(ContextEntry.PRIORITY_FACTS, factEntries.get(0).priority());
    }

    @Test
    void shouldPutFactsMatchingTheQueryFirst() {
        fillPrivateChat(3);
        fact("U1", "location", "Bandung", 0.9);
        fact("U1", "favorite_food", "bakso", 0.9);
        fact("U1", "workplace", "Gojek", 0.9);

        String content = assembler().buildContext(query(BUDI, "masih kerja di Gojek?"), BUDI)
                .entriesFrom("facts").get(0).content();

        assertEquals("""
                Known facts about Budi:
                - workplace: Gojek
                - favorite food: bakso
                - location: Bandung""", content);
    }

    @Test
    void shouldCapFactsAboutOneParticipant() {
        fillPrivateChat(3);
        for (int i = 0; i < 12; i++) {
            fact("U1", "note_" + (char) ('a' + i), "catatan " + i, 0.9);
        }

        String content = assembler().buildContext(query(BUDI, "halo"), BUDI).entriesFrom("facts").get(0).content();

        assertEquals(RelevanceAssembler.MAX_SUBJECT_FACTS + 1, content.split("\n").length);
        assertFalse(content.contains("note k"));
    }

    @Test
    void shouldAddRelevantFactsOfOtherGroupMembers() {
        add(KANTOR, "k1", "U1", "Budi", "pagi semua", T0);
        add(KANTOR, "k2", "U1", "Budi", "rapat jam 9", T0.plusSeconds(10));
        add(KANTOR, "k3", "U2", "Sarah", "siap", T0.plusSeconds(20));
        add(KANTOR, "k4", "U1", "Budi", "oke", T0.plusSeconds(30));
        fact("U1", "location", "Bandung", 0.9);
        fact("U2", "location", "Depok", 0.9);
        fact("U2", "hobby", "mancing", 0.9);
        fact("U2", "office", "Depok timur", 0.75);

        String content = assembler().buildContext(query(KANTOR, "ada yang ke Depok minggu ini?"), KANTOR)
                .entriesFrom("facts").get(0).content();

        assertEquals("""
                Known facts about Budi:
                - location: Bandung
                Facts about other members related to this message:
                - Sarah, location: Depok""", content);
    }

    @Test
    void shouldLeaveOutUnrelatedFactsOfOtherGroupMembers() {
        add(KANTOR, "k1", "U1", "Budi", "pagi semua", T0);
        add(KANTOR, "k2", "U2", "Sarah", "pagi", T0.plusSeconds(10));
        add(KANTOR, "k3", "U1", "Budi", "rapat jam 9", T0.plusSeconds(20));
        fact("U2", "hobby", "mancing", 0.9);

        assertTrue(assembler().buildContext(query(KANTOR, "rapat jam berapa?"), KANTOR)
                .entriesFrom("facts").isEmpty());
    }

    @Test
    void shouldAnswerCrossChatQuestionInClearedConversation() {
        fillPrivateChat(3);
        fact("U1", "location", "Bandung", 0.9);
        add(KANTOR, "k1", "U2", "Sarah", "Qi, tolong rangkum rapat tadi", T0.plusSeconds(600));
        add(KANTOR, "k2", "agent", "Qi", "Rapat membahas target kuartal dua.", T0.plusSeconds(660));
        add(KANTOR, "k3", "U1", "Budi", "sip", T0.plusSeconds(720));
        store.updateDisplayName(KANTOR, "Kantor Pusat");
        store.clearMessages(BUDI);

        ContextWindow window = assembler().buildContext(query(BUDI, "Qi, kamu ngobrol apa sama Sarah?"), BUDI);

        assertTrue(window.conversationEntries().isEmpty());
        assertEquals(List.of(
                "This is a private chat with Budi, who has sent 3 messages.",
                "Budi is also in groups: Kantor Pusat"),
                window.entriesFrom("chat-header").stream().map(ContextEntry::content).toList());
        assertEquals("""
                Context from other chats:
                In Kantor Pusat: Sarah said: Qi, tolong rangkum rapat tadi
                In Kantor Pusat: Qi said: Rapat membahas target kuartal dua.""",
                window.entriesFrom("cross-chat").get(0).content());
        assertEquals("Known facts about Budi:\n- location: Bandung", window.entriesFrom("facts").get(0).content());
        assertFalse(window.isDegraded());
    }

    @Test
    void shouldOrderEntriesByPriority() {
        fillPrivateChat(3);
        fact("U1", "location", "Bandung", 0.9);
        add(KANTOR, "k1", "U2", "Sarah", "halo", T0);
        add(KANTOR, "k2", "U1", "Budi", "pagi", T0.plusSeconds(5));
        add(BUDI, "a1", "agent", "Qi", "[IMAGE ANALYSIS: a whiteboard with a sales chart]", T0.plusSeconds(600));

        ContextWindow window = assembler().buildContext(query(BUDI, "foto tadi itu isinya apa?"), BUDI);

        List<String> sources = window.entries().stream().map(ContextEntry::sourceLabel).distinct().toList();
        assertEquals(List.of("chat-header", "conversation", "image", "facts"), sources);
        for (int i = 1; i < window.size(); i++) {
            assertTrue(window.entries().get(i - 1).priority() <= window.entries().get(i).priority());
        }
    }

    @Test
    void shouldBoundGroupWindow() {
        for (int i = 0; i < 40; i++) {
            String sender = i % 2 == 0 ? "U1" : "U2";
            add(KANTOR, "g" + i, sender, sender.equals("U1") ? "Budi" : "Sarah", "obrolan " + i, T0.plusSeconds(i));
        }
        add(BUDI, "p1", "U1", "Budi", "nanti aku telat", T0.plusSeconds(100));
        add("U2@s.whatsapp.net", "s1", "U2", "Sarah", "makasih ya", T0.plusSeconds(110));
        fact("U1", "location", "Bandung", 0.9);
        fact("U2", "location", "Depok", 0.9);

        ContextWindow window = assembler().buildContext(query(KANTOR, "ada apa di grup kantor?"), KANTOR);

        assertEquals(20, window.conversationEntries().size());
        assertTrue(window.injectedEntries().size() <= ContextWindow.MAX_INJECTED_ENTRIES);
        assertEquals(1, window.entriesFrom("private-context").size());
        assertEquals(1, window.entriesFrom("facts").size());
    }

    @Test
    void shouldBeDeterministic() {
        fillPrivateChat(12);
        fact("U1", "location", "Bandung", 0.9);

        RelevanceAssembler assembler = assembler();
        Message query = query(BUDI, "kamu tinggal di kota mana?");

        assertEquals(assembler.buildContext(query, BUDI), assembler.buildContext(query, BUDI));
    }

    @Test
    void shouldDegradeWhenFactStoreFails() {
        fillPrivateChat(3);
        FactStore failing = mock(FactStore.class);
        when(failing.getFacts(anyString())).thenThrow(new FactStoreException("database is locked", null));

        ContextWindow window = assembler(ContextProperties.defaults(), failing, null)
                .buildContext(query(BUDI, "halo"), BUDI);

        assertEquals(List.of("facts"), window.degradedSteps());
        assertEquals(3, window.conversationEntries().size());
        assertTrue(window.entriesFrom("facts").isEmpty());
    }

    @Test
    void shouldDegradeWhenImageLookupFails() {
        fillPrivateChat(2);
        add(BUDI, "a1", "agent", "Qi", "[IMAGE ANALYSIS: a receipt]", T0.plusSeconds(600));
        ImageSimilarityLookup failing = (text, imageQuery) -> {
            throw new IllegalStateException("index unavailable");
        };

        ContextWindow window = assembler(ContextProperties.defaults(), id -> Map.of(), failing)
                .buildContext(query(BUDI, "gambar tadi apa?"), BUDI);

        assertEquals(List.of("image"), window.degradedSteps());
        assertEquals(3, window.conversationEntries().size());
    }

    @Test
    void shouldReturnEmptyWindowForUnknownConversation() {
        ContextWindow window = assembler().buildContext(query("nobody@s.whatsapp.net", "halo"), "nobody@s.whatsapp.net");

        assertTrue(window.isEmpty());
        assertFalse(window.isDegraded());
    }

    @Test
    void shouldRejectMissingArguments() {
        fillPrivateChat(1);
        RelevanceAssembler assembler = assembler();

        assertThrows(NullPointerException.class, () -> assembler.buildContext(null, BUDI));
        assertThrows(NullPointerException.class, () -> assembler.buildContext(query(BUDI, "halo"), null));
    }

    @Test
    void shouldTreatEmptyQueryAsNoTopicSignal() {
        fillPrivateChat(4);

        ContextWindow window = assembler().buildContext(query(BUDI, ""), BUDI);

        assertEquals(List.of("m0", "m1", "m2", "m3"), conversationIds(window));
    }
}
