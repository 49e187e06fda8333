package io.contextrunr.memory;

import io.contextrunr.core.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects self-descriptions in user messages and records them as facts about the sender.
 *
 * <p>Recognizes simple English and Indonesian phrasings for names, nicknames, age, location,
 * workplace and interests. Each rule carries a fixed confidence; interests stay below the
 * default context threshold until confirmed elsewhere.</p>
 */
@Component
public class FactAutoSaver {

    private static final Logger log = LoggerFactory.getLogger(FactAutoSaver.class);
    private static final int MIN_MESSAGE_LENGTH = 8;

    // Words that end a name rather than continue it: "Budi dari Bandung", "Sarah and I"
    private static final String NAME_BREAK = "(?:dari|dan|di|yang|tapi|asal|from|and|but|i|im|here|aku|saya|gue|gw"
            + "|ya|sih|nih|kok|deh|dong)\\b";
    private static final String NAME = "([a-z]+(?:\\s(?!" + NAME_BREAK + ")[a-z]+)?)";

    record FactRule(Pattern pattern, String key, boolean slugged, double confidence) {}

    static final List<FactRule> FACT_RULES = List.of(
            // "My name is X" / "nama aku X"
            new FactRule(Pattern.compile("(?:my name is|nama (?:aku|saya|gue|gw)(?: adalah)?)\\s+" + NAME,
                    Pattern.CASE_INSENSITIVE), "name", false, 0.9),
            // "Call me X" / "panggil aku X"
            new FactRule(Pattern.compile("(?:call me|panggil (?:aku|saya|gue|gw))\\s+([a-z]+)",
                    Pattern.CASE_INSENSITIVE), "nickname", false, 0.85),
            // "I'm 25 years old" / "umur aku 25"
            new FactRule(Pattern.compile("(?:i'?m|i am)\\s+(\\d{1,3})\\s+years? old", Pattern.CASE_INSENSITIVE),
                    "age", false, 0.85),
            new FactRule(Pattern.compile("umur (?:aku|saya|gue|gw)\\s+(\\d{1,3})", Pattern.CASE_INSENSITIVE),
                    "age", false, 0.85),
            // "I live in X" / "aku tinggal di X"
            new FactRule(Pattern.compile("(?:i live in|i'm from|(?:aku|saya|gue|gw) tinggal di)\\s+(.{3,50}?)(?:[.,!?]|$)",
                    Pattern.CASE_INSENSITIVE), "location", false, 0.8),
            // "I work at X" / "aku kerja di X"
            new FactRule(Pattern.compile("(?:i work (?:at|for)|(?:aku|saya|gue|gw) (?:kerja|bekerja) di)\\s+(.{3,50}?)(?:[.,!?]|$)",
                    Pattern.CASE_INSENSITIVE), "workplace", false, 0.8),
            // "I love X" / "aku suka X"
            new FactRule(Pattern.compile("(?:i like|i love|(?:aku|saya|gue|gw) suka)\\s+(.{3,50}?)(?:[.,!?]|$)",
                    Pattern.CASE_INSENSITIVE), "interest", true, 0.7)
    );

    private final MutableFactStore factStore;
    private final Clock clock;

    public FactAutoSaver(MutableFactStore factStore, Clock clock) {
        this.factStore = factStore;
        this.clock = clock;
    }

    /**
     * Scans a user message and records the facts it states about its sender.
     *
     * @param message the recorded message
     * @return number of facts saved
     */
    public int scanAndSave(Message message) {
        if (message == null || message.role() != Message.Role.USER
                || message.content().length() < MIN_MESSAGE_LENGTH) {
            return 0;
        }

        int saved = 0;
        var known = factStore.getFacts(message.senderId());

        for (FactRule rule : FACT_RULES) {
            Matcher matcher = rule.pattern().matcher(message.content());
            while (matcher.find()) {
                String value = matcher.group(1).trim();
                if (value.isEmpty() || value.length() > 50) continue;

                String key = rule.slugged() ? rule.key() + "_" + slug(value) : rule.key();
                Fact existing = known.get(key);
                if (existing != null && existing.value().equalsIgnoreCase(value)) {
                    continue;
                }

                factStore.recordFact(new Fact(message.senderId(), key, value, rule.confidence(),
                        message.id(), clock.instant()));
                log.debug("Auto-saved fact for {}: {} = {}", message.senderId(), key, value);
                saved++;
            }
        }

        return saved;
    }

    private static String slug(String value) {
        String lower = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        lower = lower.replaceAll("^_+|_+$", "");
        return lower.length() > 20 ? lower.substring(0, 20) : lower;
    }
}
