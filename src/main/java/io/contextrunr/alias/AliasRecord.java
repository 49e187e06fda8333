package io.contextrunr.alias;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalized aliases of one participant, in registration order.
 *
 * <p>{@code relatedNames} hold names of people the participant is related to
 * ({@code relationship_sarah_friend}); they identify the participant only weakly.</p>
 */
public record AliasRecord(String participantId, String displayName, Set<String> aliases, Set<String> relatedNames) {

    public AliasRecord {
        aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        relatedNames = Collections.unmodifiableSet(new LinkedHashSet<>(relatedNames));
    }

    public AliasRecord(String participantId, String displayName, Set<String> aliases) {
        this(participantId, displayName, aliases, Set.of());
    }
}
