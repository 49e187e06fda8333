package io.contextrunr.memory;

import java.time.Instant;
import java.util.Objects;

/**
 * A confidence-scored belief about a participant.
 *
 * @param subjectId       participant the fact is about
 * @param key             fact key, e.g. {@code nickname}, {@code location}
 * @param value           fact value
 * @param confidence      confidence in [0, 1], clamped on creation
 * @param sourceMessageId message the fact was extracted from, or null
 * @param updatedAt       last time the value was confirmed or changed
 */
public record Fact(
        String subjectId,
        String key,
        String value,
        double confidence,
        String sourceMessageId,
        Instant updatedAt
) {
    public Fact {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public boolean isAtLeast(double threshold) {
        return confidence >= threshold;
    }
}
