package io.contextrunr.classify;

import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps free text to topic tags using a fixed keyword table (Indonesian and English).
 * A message may carry several tags.
 */
@Component
public class TopicClassifier {

    /**
     * A single tagging rule, matched with {@code find()} against lower-cased text.
     */
    public record TopicRule(Pattern pattern, TopicTag tag) {

        static TopicRule of(String regex, TopicTag tag) {
            return new TopicRule(Pattern.compile(regex), tag);
        }

        public boolean matches(String lowerText) {
            return pattern.matcher(lowerText).find();
        }
    }

    static final List<TopicRule> RULES = List.of(
            TopicRule.of("\\b(?:nama|name|panggil)", TopicTag.IDENTITY),
            TopicRule.of("\\b(?:umur|usia|age\\b|tua\\b|birthday|ulang tahun)", TopicTag.AGE),
            TopicRule.of("\\b(?:rumah|home|tinggal|live|kota|city)", TopicTag.LOCATION),
            TopicRule.of("\\b(?:kerja|work|job|profesi|kantor|office)", TopicTag.WORK),
            TopicRule.of("\\b(?:hobi|hobby|suka|like|gemar)", TopicTag.INTERESTS),
            TopicRule.of("\\b(?:makan|food|restoran|restaurant|masak)", TopicTag.FOOD),
            TopicRule.of("\\b(?:musik|music|lagu|song)", TopicTag.MUSIC),
            TopicRule.of("\\b(?:film|movie|nonton|watch|series)", TopicTag.ENTERTAINMENT),
            TopicRule.of("\\b(?:olahraga|sport|main|play|game)", TopicTag.SPORTS),
            TopicRule.of("\\b(?:kuliah|study|sekolah|school|belajar)", TopicTag.EDUCATION),
            TopicRule.of("\\b(?:gambar|foto|image|picture|photo)", TopicTag.IMAGE),
            TopicRule.of("\\?|\\b(?:apa|siapa|kapan|dimana|mengapa|kenapa|bagaimana|gimana|how|what|when|where|why|who)\\b",
                    TopicTag.QUESTION),
            TopicRule.of("\\b(?:halo|hai|hello|hi|selamat|pagi|siang|sore|malam)\\b", TopicTag.GREETING),
            TopicRule.of("\\b(?:tolong|bantu|help|assist|bisa|can you|could you)", TopicTag.REQUEST)
    );

    /**
     * Returns every tag whose rule matches the text.
     *
     * @param text free text, may be null
     * @return matching tags, empty for null or blank text
     */
    public Set<TopicTag> classifyTopics(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        EnumSet<TopicTag> tags = EnumSet.noneOf(TopicTag.class);
        for (TopicRule rule : RULES) {
            if (rule.matches(lower)) {
                tags.add(rule.tag());
            }
        }
        return tags;
    }
}
