package io.contextrunr.classify;

import java.util.Optional;

/**
 * Result of cross-chat intent classification.
 *
 * @param isCrossChatQuestion whether the text asks about another conversation
 * @param type                kind of cross-chat question
 * @param targetName          person the question is about, or null if none was identified
 * @param targetChat          chat the question is about, or null if none was identified
 * @param ruleName            name of the matching rule, or null when nothing matched
 */
public record CrossChatIntent(
        boolean isCrossChatQuestion,
        Type type,
        String targetName,
        String targetChat,
        String ruleName
) {
    public enum Type {
        MOOD, CONVERSATION, GROUP_ACTIVITY, NONE
    }

    private static final CrossChatIntent NONE = new CrossChatIntent(false, Type.NONE, null, null, null);

    public static CrossChatIntent none() {
        return NONE;
    }

    public static CrossChatIntent of(Type type, String targetName, String targetChat, String ruleName) {
        return new CrossChatIntent(type != Type.NONE, type, targetName, targetChat, ruleName);
    }

    public Optional<String> target() {
        return Optional.ofNullable(targetName);
    }

    public Optional<String> chat() {
        return Optional.ofNullable(targetChat);
    }
}
