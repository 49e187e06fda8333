package io.contextrunr.classify;

import java.util.Locale;

/**
 * Topic tags assigned to message text.
 */
public enum TopicTag {
    IDENTITY,
    AGE,
    LOCATION,
    WORK,
    INTERESTS,
    FOOD,
    MUSIC,
    ENTERTAINMENT,
    SPORTS,
    EDUCATION,
    IMAGE,
    QUESTION,
    GREETING,
    REQUEST;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
