package io.contextrunr.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects questions about the agent's mood or activity in other conversations.
 *
 * <p>Rules are evaluated in declaration order and the first match wins:
 * mood, then group activity, then conversation-with-person, then the generic
 * name-first fallback. Each rule declares which capture group holds the person
 * and which holds the chat, since phrasings place them differently.</p>
 *
 * <p>Mentions of the agent's own name are read as "you" before matching.</p>
 */
@Component
public class CrossChatIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(CrossChatIntentClassifier.class);

    private static final String YOU = "(?:kamu|kau|lu|lo|elu|you)";
    private static final String HONORIFIC = "(?:si|pak|bu|mas|mbak|bang|kak)";
    private static final String NAME = "([a-z][\\w.-]*)";
    private static final String CHAT = "([a-z0-9][\\w-]*(?:\\s+[a-z0-9][\\w-]*)?)";
    private static final String CHAT_WORD = "([a-z0-9][\\w-]*)";
    private static final String MOOD = "(?:marah|kesal|kesel|sedih|bete|badmood|galak|jutek|ngambek|senang|seneng"
            + "|happy|sad|angry|mad|upset|moody|grumpy)";
    private static final String IN_OTHER_CHAT = "(?:di|in)\\s+(?:the\\s+)?(?:grup|group|gc|chat)(?:\\s+" + CHAT + ")?";
    private static final String EARLIER = "(?:tadi|kemarin|barusan|earlier|yesterday)";
    private static final String SAID = "(?:ngomong|bilang|cerita|nanya|ngobrol)";

    private static final Pattern TRAILING_TIME = Pattern.compile("(?:\\s+" + EARLIER + ")+$");
    private static final Pattern MENTION = Pattern.compile("@(\\w)");

    static final Set<String> STOPWORDS = Set.of(
            "apa", "dengan", "sama", "ama", "bareng", "yang", "aja", "siapa", "dia", "mereka",
            "kamu", "kau", "lu", "lo", "elu", "aku", "saya", "gue", "gw", "kita", "kami",
            "you", "i", "me", "they", "he", "she", "it", "we", "anything", "something", "everyone", "people",
            "grup", "group", "gc", "chat", "di", "ke", "the", "with", "about",
            "tadi", "kemarin", "barusan", "itu", "ini", "sini", "sana"
    );

    /**
     * A single intent rule.
     *
     * @param name      rule name, reported on the resulting intent
     * @param type      intent type when the rule matches
     * @param pattern   pattern matched with {@code find()} against normalized text
     * @param nameGroup capture group holding the person, 0 if none
     * @param chatGroup capture group holding the chat, 0 if none
     * @param needsName whether the rule only applies when a real name was captured
     */
    public record IntentRule(String name, CrossChatIntent.Type type, Pattern pattern, int nameGroup, int chatGroup,
                             boolean needsName) {

        static IntentRule of(String name, CrossChatIntent.Type type, String regex, int nameGroup, int chatGroup) {
            return new IntentRule(name, type, Pattern.compile(regex), nameGroup, chatGroup, false);
        }

        /** A name-first phrasing; "kamu bilang apa" is not a question about someone else. */
        static IntentRule nameFirst(String name, String regex) {
            return new IntentRule(name, CrossChatIntent.Type.CONVERSATION, Pattern.compile(regex), 1, 0, true);
        }
    }

    static final List<IntentRule> RULES = List.of(
            // mood
            IntentRule.of("mood-why-in-chat", CrossChatIntent.Type.MOOD,
                    "\\b(?:kenapa|mengapa|why)\\b.*?\\b" + YOU + "\\b.*?\\b" + MOOD + "\\b.*?\\b" + IN_OTHER_CHAT, 0, 1),
            IntentRule.of("mood-state-in-chat", CrossChatIntent.Type.MOOD,
                    "\\b" + YOU + "\\s+(?:lagi\\s+|sedang\\s+|tadi\\s+|were\\s+|was\\s+|are\\s+)?" + MOOD + "\\b.*?\\b" + IN_OTHER_CHAT, 0, 1),
            IntentRule.of("mood-why-earlier", CrossChatIntent.Type.MOOD,
                    "\\b(?:kenapa|mengapa|why)\\b.*?\\b" + YOU + "\\b.*?\\b" + MOOD + "\\b.*?\\b" + EARLIER + "\\b", 0, 0),
            IntentRule.of("mood-of-agent-in-chat", CrossChatIntent.Type.MOOD,
                    "\\bmood\\s+" + YOU + "\\b.*?\\b" + IN_OTHER_CHAT, 0, 1),

            // group activity
            IntentRule.of("group-what-happened", CrossChatIntent.Type.GROUP_ACTIVITY,
                    "\\bapa\\s+(?:aja\\s+)?yang\\s+(?:lagi\\s+)?(?:terjadi|dibahas|diomongin|diobrolin|dibicarakan|rame|seru)"
                            + "\\s+di\\s+(?:grup|group|gc)(?:\\s+" + CHAT + ")?", 0, 1),
            IntentRule.of("group-ada-apa", CrossChatIntent.Type.GROUP_ACTIVITY,
                    "\\bada\\s+apa\\s+(?:aja\\s+)?di\\s+(?:grup|group|gc)(?:\\s+" + CHAT + ")?", 0, 1),
            IntentRule.of("group-talking-about", CrossChatIntent.Type.GROUP_ACTIVITY,
                    "\\b(?:grup|group|gc)\\s+" + CHAT_WORD + "\\s+(?:lagi\\s+)?(?:ngomongin|bahas|ngobrolin|rame|seru)\\s+(?:soal\\s+)?apa", 0, 1),
            IntentRule.of("group-happening", CrossChatIntent.Type.GROUP_ACTIVITY,
                    "\\bwhat(?:'s|\\s+is|\\s+was)?\\s+(?:happening|going on|new)\\s+in\\s+(?:the\\s+)?" + CHAT_WORD + "\\s+(?:group|chat)", 0, 1),
            IntentRule.of("group-people-talk", CrossChatIntent.Type.GROUP_ACTIVITY,
                    "\\bwhat\\s+(?:did|are|were)\\s+(?:people|they|everyone)\\s+(?:talk|talking|chat|chatting|discuss|discussing)"
                            + "\\s+about\\s+in\\s+(?:the\\s+)?" + CHAT_WORD, 0, 1),

            // conversation with a person
            IntentRule.of("talk-with-person", CrossChatIntent.Type.CONVERSATION,
                    "\\b" + YOU + "\\s+(?:tadi\\s+)?(?:ngobrol|ngobrolin|chat|chatting|chatan|bicara|ngomong|ngomongin|cerita|bahas)"
                            + "\\s+(?:apa\\s+)?(?:aja\\s+)?(?:dengan|sama|ama|with|bareng)\\s+(?:" + HONORIFIC + "\\s+)?" + NAME, 1, 0),
            IntentRule.of("what-talked-with-person", CrossChatIntent.Type.CONVERSATION,
                    "\\bapa\\s+(?:aja\\s+)?yang\\s+" + YOU + "\\s+(?:omongin|obrolin|bahas|bicarakan|ngomongin|obrolkan|ceritain)"
                            + "\\s+(?:dengan|sama|ama|bareng)\\s+(?:" + HONORIFIC + "\\s+)?" + NAME, 1, 0),
            IntentRule.of("talked-with-person-en", CrossChatIntent.Type.CONVERSATION,
                    "\\bwhat\\s+did\\s+you\\s+(?:talk|chat|discuss)\\s+(?:about\\s+)?with\\s+" + NAME, 1, 0),
            IntentRule.of("person-said-to-you-en", CrossChatIntent.Type.CONVERSATION,
                    "\\bdid\\s+" + NAME + "\\s+(?:say|tell|mention)\\s+(?:anything\\s+|something\\s+)?(?:to\\s+)?you\\b", 1, 0),
            IntentRule.of("honorific-name-first", CrossChatIntent.Type.CONVERSATION,
                    "\\b" + HONORIFIC + "\\s+" + NAME + "\\s+(?:" + EARLIER + "\\s+)?" + SAID + "\\s+apa", 1, 0),
            IntentRule.nameFirst("name-first-to-you",
                    "\\b" + NAME + "\\s+(?:" + EARLIER + "\\s+)?" + SAID + "\\s+apa\\s+(?:aja\\s+)?(?:ke|sama|ama|kepada)\\s+" + YOU + "\\b"),

            // generic fallback
            IntentRule.nameFirst("name-first",
                    "^" + NAME + "\\s+(?:" + EARLIER + "\\s+)?" + SAID + "\\s+apa\\b")
    );

    /**
     * Classifies a message as a cross-chat question.
     *
     * @param text      the message text, may be null
     * @param agentName the agent's display name; its mentions are treated as "you"
     * @return the first matching intent, or {@link CrossChatIntent#none()}
     */
    public CrossChatIntent classifyCrossChatIntent(String text, String agentName) {
        if (text == null || text.isBlank()) {
            return CrossChatIntent.none();
        }

        String normalized = normalize(text, agentName);
        String agentLower = agentName == null ? "" : agentName.toLowerCase(Locale.ROOT).trim();

        for (IntentRule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(normalized);
            if (!matcher.find()) {
                continue;
            }
            String targetName = capture(matcher, rule.nameGroup(), agentLower);
            if (rule.needsName() && targetName == null) {
                continue;
            }
            String targetChat = capture(matcher, rule.chatGroup(), agentLower);
            log.debug("Cross-chat rule '{}' matched: type={}, name={}, chat={}",
                    rule.name(), rule.type(), targetName, targetChat);
            return CrossChatIntent.of(rule.type(), targetName, targetChat, rule.name());
        }
        return CrossChatIntent.none();
    }

    static String normalize(String text, String agentName) {
        String lower = MENTION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("$1");
        if (agentName != null && !agentName.isBlank()) {
            String agent = agentName.toLowerCase(Locale.ROOT).trim();
            lower = lower.replaceAll("(?<![\\w])" + Pattern.quote(agent) + "(?![\\w])", "kamu");
        }
        return lower.replaceAll("\\s+", " ").trim();
    }

    /** Captured token, or null when absent, a stopword, or the agent itself. */
    private static String capture(Matcher matcher, int group, String agentLower) {
        if (group <= 0 || group > matcher.groupCount()) {
            return null;
        }
        String value = matcher.group(group);
        if (value == null) {
            return null;
        }
        value = TRAILING_TIME.matcher(value.trim()).replaceAll("").replaceAll("[.\\-]+$", "").trim();
        if (value.isEmpty() || STOPWORDS.contains(value) || value.equals(agentLower)) {
            return null;
        }
        return value;
    }
}
