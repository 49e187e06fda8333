package io.contextrunr.thread;

import io.contextrunr.core.Message;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ThreadRankerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");

    private final ThreadSegmenter segmenter = new ThreadSegmenter();
    private final ThreadRanker ranker = new ThreadRanker();

    private static ConversationThread thread(Message... messages) {
        return new ConversationThread(0, List.of(messages));
    }

    private static Message user(String sender, String text) {
        return Message.user("m-" + sender + text.hashCode(), "kantor@g.us", sender, sender, text, T0);
    }

    @Test
    void shouldRankQuestionThreadFirst() {
        List<Message> chat = ThreadSegmenterTest.breakfastChat();
        List<ConversationThread> threads = segmenter.segmentThreads(chat);
        ThreadRankingContext context = new ThreadRankingContext("agent", ThreadRanker.topSenders(chat, 3), 2);

        List<ScoredThread> ranked = ranker.rankThreads(threads, context);

        assertEquals(2, ranked.size());
        assertEquals(2, ranked.get(0).thread().index());
        assertEquals(7, ranked.get(0).score());
        assertEquals(0, ranked.get(1).thread().index());
        assertEquals(4, ranked.get(1).score());
        assertEquals(3, ranked.get(0).score() - ranked.get(1).score());
    }

    @Test
    void shouldRewardAgentInvolvement() {
        ThreadRankingContext context = new ThreadRankingContext("agent", Set.of(), 1);
        ConversationThread withAgent = thread(user("A", "halo"),
                Message.agent("a1", "kantor@g.us", "agent", "Qi", "halo juga", T0));
        ConversationThread withoutAgent = thread(user("A", "halo"), user("B", "halo juga"));

        assertEquals(ranker.score(withoutAgent, context) + 4, ranker.score(withAgent, context));
    }

    @Test
    void shouldCapSizePoints() {
        ThreadRankingContext context = new ThreadRankingContext("agent", Set.of(), 1);
        ConversationThread big = new ConversationThread(0, ThreadSegmenterTest.messages(
                "A", "1", "A", "2", "A", "3", "A", "4", "A", "5", "A", "6", "A", "7"));

        assertEquals(ThreadRanker.MAX_SIZE_POINTS, ranker.score(big, context));
    }

    @Test
    void shouldDetectEmotionalMessages() {
        assertTrue(ThreadRanker.isEmotional("asik!"));
        assertTrue(ThreadRanker.isEmotional("mantap :D"));
        assertTrue(ThreadRanker.isEmotional("selamat 🎉"));
        assertFalse(ThreadRanker.isEmotional("jam 12 di kantin"));
    }

    @Test
    void shouldKeepThreadOrderForEqualScores() {
        List<ConversationThread> threads = List.of(
                new ConversationThread(0, List.of(user("A", "satu"))),
                new ConversationThread(1, List.of(user("B", "dua"))),
                new ConversationThread(2, List.of(user("C", "tiga"))));

        List<ScoredThread> ranked = ranker.rankThreads(threads, new ThreadRankingContext("agent", Set.of(), 5));

        assertEquals(List.of(0, 1, 2), ranked.stream().map(s -> s.thread().index()).toList());
    }

    @Test
    void shouldPickTopSendersWithFirstSeenTieBreak() {
        List<Message> chat = ThreadSegmenterTest.messages("A", "x", "B", "x", "C", "x", "B", "x", "C", "x", "D", "x");

        assertEquals(List.of("B", "C"), List.copyOf(ThreadRanker.topSenders(chat, 2)));
    }

    @Test
    void shouldRejectNonPositiveTopK() {
        assertThrows(IllegalArgumentException.class, () -> new ThreadRankingContext("agent", Set.of(), 0));
        assertTrue(ranker.rankThreads(List.of(), new ThreadRankingContext("agent", Set.of(), 1)).isEmpty());
    }
}
