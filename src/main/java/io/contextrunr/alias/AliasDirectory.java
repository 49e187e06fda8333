package io.contextrunr.alias;

import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.ParticipantState;
import io.contextrunr.memory.ConversationStore;
import io.contextrunr.memory.Fact;
import io.contextrunr.memory.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-form names ("budi", "pak budi", "@budi", a phone number) to participant ids.
 *
 * <p>Aliases come from participant display names and from name-like facts. Names found in
 * relationship facts are kept apart and only score weakly, so a participant who mentions a
 * friend never outranks the friend. The directory
 * is derived data: it is rebuilt whenever the conversation store or the fact store reports
 * a new generation, and never persisted.</p>
 */
@Component
public class AliasDirectory {

    private static final Logger log = LoggerFactory.getLogger(AliasDirectory.class);

    static final Set<String> NAME_FACT_KEYS = Set.of(
            "name", "full_name", "nickname", "first_name", "last_name", "alias", "called");
    private static final String NICKNAME_SUFFIX = "_nickname";
    private static final Pattern RELATIONSHIP_KEY = Pattern.compile("^relationship_(.+?)_[a-z0-9]+$");

    private final ConversationStore conversationStore;
    private final FactStore factStore;
    private final AliasScorer scorer;
    private final int minAliasScore;

    private volatile Snapshot snapshot;

    private record Snapshot(long conversationGeneration, long factGeneration, List<AliasRecord> records) {}

    public AliasDirectory(ConversationStore conversationStore, FactStore factStore,
                          AliasScorer scorer, ContextProperties properties) {
        this.conversationStore = conversationStore;
        this.factStore = factStore;
        this.scorer = scorer;
        this.minAliasScore = properties.minAliasScore();
    }

    /**
     * Resolves a name to matching participants.
     *
     * @param nameQuery a name, nickname, {@code @mention} or phone number
     * @return candidates scoring at least {@code context.min-alias-score}, best first;
     *         equal scores keep directory order
     */
    public List<AliasCandidate> resolveCandidates(String nameQuery) {
        AliasQuery query = AliasQuery.parse(nameQuery);
        if (query.isEmpty()) {
            return List.of();
        }

        List<AliasCandidate> candidates = new ArrayList<>();
        for (AliasRecord record : records()) {
            int score = scorer.score(query, record.participantId(), record.aliases(), record.relatedNames());
            if (score >= minAliasScore && score > 0) {
                candidates.add(new AliasCandidate(record.participantId(), record.displayName(), score));
            }
        }
        candidates.sort(Comparator.comparingInt(AliasCandidate::score).reversed());

        log.debug("Resolved '{}' to {} candidate(s)", query.normalized(), candidates.size());
        return List.copyOf(candidates);
    }

    /** The highest-scoring candidate, if any. */
    public Optional<AliasCandidate> resolveBest(String nameQuery) {
        List<AliasCandidate> candidates = resolveCandidates(nameQuery);
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /** Current alias records, rebuilding them if either store changed. */
    public List<AliasRecord> records() {
        long conversationGeneration = conversationStore.generation();
        long factGeneration = factStore.generation();
        Snapshot current = snapshot;
        if (current != null && current.conversationGeneration() == conversationGeneration
                && current.factGeneration() == factGeneration) {
            return current.records();
        }

        BuildResult built = build();
        if (built.complete()) {
            snapshot = new Snapshot(conversationGeneration, factGeneration, built.records());
        }
        return built.records();
    }

    private record BuildResult(List<AliasRecord> records, boolean complete) {}

    private BuildResult build() {
        Map<String, String> displayNames = new LinkedHashMap<>();
        Map<String, Set<String>> aliases = new LinkedHashMap<>();
        Map<String, Set<String>> related = new LinkedHashMap<>();

        for (Conversation conversation : conversationStore.listConversations()) {
            for (ParticipantState participant : conversation.getParticipants().values()) {
                displayNames.put(participant.id(), participant.displayName());
                register(aliases.computeIfAbsent(participant.id(), id -> new LinkedHashSet<>()),
                        participant.displayName());
            }
        }

        boolean complete = true;
        for (Map.Entry<String, Set<String>> entry : aliases.entrySet()) {
            try {
                Set<String> relatedNames = related.computeIfAbsent(entry.getKey(), id -> new LinkedHashSet<>());
                for (Fact fact : factStore.getFacts(entry.getKey()).values()) {
                    aliasFromFact(fact).ifPresent(alias -> register(entry.getValue(), alias));
                    relatedNameFromFact(fact).ifPresent(name -> register(relatedNames, name));
                }
            } catch (RuntimeException e) {
                complete = false;
                log.warn("Fact lookup failed while building aliases for {}: {}", entry.getKey(), e.getMessage());
            }
        }

        List<AliasRecord> records = new ArrayList<>(aliases.size());
        aliases.forEach((id, set) -> records.add(
                new AliasRecord(id, displayNames.get(id), set, related.getOrDefault(id, Set.of()))));
        log.debug("Built alias directory: {} participants", records.size());
        return new BuildResult(List.copyOf(records), complete);
    }

    static Optional<String> aliasFromFact(Fact fact) {
        String key = fact.key();
        if (NAME_FACT_KEYS.contains(key) || key.endsWith(NICKNAME_SUFFIX)) {
            return Optional.ofNullable(fact.value());
        }
        return Optional.empty();
    }

    /** The person named in a {@code relationship_<name>_<kind>} key. */
    static Optional<String> relatedNameFromFact(Fact fact) {
        Matcher relationship = RELATIONSHIP_KEY.matcher(fact.key());
        if (relationship.matches()) {
            return Optional.of(relationship.group(1).replace('_', ' '));
        }
        return Optional.empty();
    }

    /** Adds a normalized alias and, for multi-word aliases, its words longer than two characters. */
    static void register(Set<String> aliases, String rawAlias) {
        String alias = AliasQuery.normalize(rawAlias);
        if (alias.isEmpty()) {
            return;
        }
        aliases.add(alias);
        List<String> tokens = AliasQuery.tokens(alias);
        if (tokens.size() > 1) {
            for (String token : tokens) {
                if (token.length() > 2) {
                    aliases.add(token);
                }
            }
        }
    }
}
