package io.contextrunr.thread;

import io.contextrunr.core.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Scores threads and keeps the best ones.
 *
 * <p>Score is the thread size (at most 5) plus a bonus per rule: a question, the agent taking
 * part, one of the most active senders taking part, and an exclamation or emotional glyph.</p>
 */
@Component
public class ThreadRanker {

    public static final int MAX_SIZE_POINTS = 5;

    private static final List<String> EMOTICONS = List.of(":)", ":(", ":d", ":p", ";)", "xd", "<3");

    record ThreadBonus(String name, int points, BiPredicate<ConversationThread, ThreadRankingContext> applies) {}

    static final List<ThreadBonus> BONUSES = List.of(
            new ThreadBonus("question", 3, (thread, ctx) -> thread.hasQuestion()),
            new ThreadBonus("agent-involved", 4,
                    (thread, ctx) -> ctx.agentId() != null && thread.hasSender(ctx.agentId())),
            new ThreadBonus("active-sender", 2,
                    (thread, ctx) -> thread.senderIds().stream().anyMatch(ctx.activeSenders()::contains)),
            new ThreadBonus("emotional", 2,
                    (thread, ctx) -> thread.messages().stream().anyMatch(m -> isEmotional(m.content())))
    );

    public int score(ConversationThread thread, ThreadRankingContext context) {
        int score = Math.min(MAX_SIZE_POINTS, thread.size());
        for (ThreadBonus bonus : BONUSES) {
            if (bonus.applies().test(thread, context)) {
                score += bonus.points();
            }
        }
        return score;
    }

    /**
     * Ranks threads and returns the top {@code context.topK()}, best first.
     * Equal scores keep thread order.
     */
    public List<ScoredThread> rankThreads(List<ConversationThread> threads, ThreadRankingContext context) {
        if (threads == null || threads.isEmpty()) {
            return List.of();
        }
        List<ScoredThread> scored = new ArrayList<>(threads.size());
        for (ConversationThread thread : threads) {
            scored.add(new ScoredThread(thread, score(thread, context)));
        }
        scored.sort(Comparator.comparingInt(ScoredThread::score).reversed());
        return List.copyOf(scored.subList(0, Math.min(context.topK(), scored.size())));
    }

    /**
     * The {@code n} senders with the most messages; ties go to the sender seen first.
     */
    public static Set<String> topSenders(List<Message> messages, int n) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Message message : messages) {
            counts.merge(message.senderId(), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        Set<String> top = new LinkedHashSet<>();
        for (Map.Entry<String, Integer> entry : entries) {
            if (top.size() >= n) break;
            top.add(entry.getKey());
        }
        return top;
    }

    static boolean isEmotional(String content) {
        if (content.indexOf('!') >= 0) {
            return true;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (String emoticon : EMOTICONS) {
            if (lower.contains(emoticon)) return true;
        }
        return content.codePoints().anyMatch(ThreadRanker::isEmoji);
    }

    private static boolean isEmoji(int codePoint) {
        return (codePoint >= 0x1F300 && codePoint <= 0x1FAFF)
                || (codePoint >= 0x2600 && codePoint <= 0x27BF);
    }
}
