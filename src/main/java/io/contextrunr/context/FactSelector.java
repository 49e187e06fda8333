package io.contextrunr.context;

import io.contextrunr.memory.Fact;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Orders facts by how well they match the words of a query.
 *
 * <p>Every query keyword that matches a word of the fact key adds {@link #KEY_MATCH_POINTS},
 * every keyword that matches a word of the value adds {@link #VALUE_MATCH_POINTS}. Words match
 * when either contains the other. Ties fall back to key order.</p>
 */
@Component
public class FactSelector {

    static final int KEY_MATCH_POINTS = 4;
    static final int VALUE_MATCH_POINTS = 3;
    static final int MIN_WORD_LENGTH = 3;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final Set<String> STOPWORDS = Set.of(
            "the", "and", "but", "for", "with", "are", "was", "were", "been", "being", "have", "has", "had",
            "does", "did", "will", "would", "could", "should", "may", "might", "can", "this", "that", "these",
            "those", "you", "him", "her", "them", "they", "she", "your", "his", "its", "our", "their", "mine",
            "yours", "what", "when", "where", "why", "how", "who", "which", "whom", "whose",
            "apa", "yang", "dan", "ini", "itu", "aku", "kamu", "dia", "ada", "sih", "dong", "nih", "kok",
            "deh", "gue", "saya", "mereka", "kita", "kami", "mana", "siapa", "kapan", "kenapa", "gimana",
            "bagaimana", "tau", "tahu", "udah", "sudah", "belum", "lagi", "juga", "aja", "saja", "dari", "untuk");

    /** Lower-cased query words of at least three letters, stopwords removed, first occurrence order. */
    public Set<String> keywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null) {
            return keywords;
        }
        for (String word : words(text)) {
            if (!STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    public int relevance(Fact fact, Set<String> keywords) {
        if (keywords.isEmpty()) {
            return 0;
        }
        List<String> keyWords = words(fact.key());
        List<String> valueWords = words(fact.value());
        int score = 0;
        for (String keyword : keywords) {
            if (matchesAny(keyword, keyWords)) {
                score += KEY_MATCH_POINTS;
            }
            if (matchesAny(keyword, valueWords)) {
                score += VALUE_MATCH_POINTS;
            }
        }
        return score;
    }

    /**
     * Most relevant facts first, then by key.
     *
     * @param facts    candidate facts
     * @param keywords query keywords
     * @param limit    maximum number of facts returned
     */
    public List<Fact> rank(List<Fact> facts, Set<String> keywords, int limit) {
        return facts.stream()
                .sorted(Comparator.comparingInt((Fact f) -> relevance(f, keywords)).reversed()
                        .thenComparing(Fact::key))
                .limit(limit)
                .toList();
    }

    private static boolean matchesAny(String keyword, List<String> words) {
        for (String word : words) {
            if (word.contains(keyword) || keyword.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> words(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(w -> w.length() >= MIN_WORD_LENGTH)
                .toList();
    }
}
