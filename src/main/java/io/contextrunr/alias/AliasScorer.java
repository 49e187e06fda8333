package io.contextrunr.alias;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a set of aliases against a name query.
 *
 * <p>An exact alias match scores {@link #EXACT_MATCH_SCORE}. Otherwise the partial rules are
 * summed, each firing at most once per alias set, and capped at {@link #PARTIAL_MATCH_CEILING}
 * so an exact match always outranks any partial one. Names of related people are scored the same
 * way but capped at {@link #RELATED_NAME_CEILING}, far below an exact match on someone's own name. A phone-number match adds {@link #PHONE_MATCH_SCORE} on top of any of these.</p>
 */
@Component
public class AliasScorer {

    public static final int EXACT_MATCH_SCORE = 10;
    public static final int PARTIAL_MATCH_CEILING = 9;
    public static final int PHONE_MATCH_SCORE = 15;
    public static final int RELATED_NAME_CEILING = 4;

    private static final Pattern ID_DIGITS = Pattern.compile("^(\\d+)");

    /**
     * A partial name rule; fires when any alias satisfies the test.
     */
    record MatchRule(String name, int points, BiPredicate<AliasQuery, String> test) {

        boolean firesFor(AliasQuery query, Collection<String> aliases) {
            for (String alias : aliases) {
                if (test.test(query, alias)) {
                    return true;
                }
            }
            return false;
        }
    }

    static final List<MatchRule> PARTIAL_RULES = List.of(
            new MatchRule("alias-contains-query", 5,
                    (q, alias) -> alias.length() > q.normalized().length() && alias.contains(q.normalized())),
            new MatchRule("query-contains-alias", 3,
                    (q, alias) -> alias.length() > 2 && alias.length() < q.normalized().length()
                            && q.normalized().contains(alias)),
            new MatchRule("honorific-token", 4,
                    (q, alias) -> q.honorificTarget() != null
                            && AliasQuery.tokens(alias).contains(q.honorificTarget())),
            new MatchRule("token-prefix", 2,
                    (q, alias) -> anyTokenPair(q, alias, String::startsWith)),
            new MatchRule("token-suffix", 3,
                    (q, alias) -> anyTokenPair(q, alias, String::endsWith)),
            new MatchRule("last-token", 5,
                    (q, alias) -> {
                        List<String> tokens = AliasQuery.tokens(alias);
                        return tokens.size() > 1 && tokens.get(tokens.size() - 1).equals(q.normalized());
                    })
    );

    /**
     * Scores one participant.
     *
     * @param query         the parsed query
     * @param participantId the participant id, checked against the query's phone digits
     * @param aliases       the participant's normalized aliases
     * @return the score, 0 when nothing matches
     */
    public int score(AliasQuery query, String participantId, Collection<String> aliases) {
        return score(query, participantId, aliases, List.of());
    }

    /**
     * Scores one participant, also considering names of people related to it.
     *
     * @param relatedNames normalized names taken from the participant's relationship facts
     */
    public int score(AliasQuery query, String participantId, Collection<String> aliases,
                     Collection<String> relatedNames) {
        if (query.isEmpty()) {
            return 0;
        }
        int score = scoreName(query, aliases);
        if (!relatedNames.isEmpty()) {
            score = Math.max(score, Math.min(scoreName(query, relatedNames), RELATED_NAME_CEILING));
        }
        if (phoneMatches(query, participantId)) {
            score += PHONE_MATCH_SCORE;
        }
        return score;
    }

    int scoreName(AliasQuery query, Collection<String> aliases) {
        if (aliases.contains(query.normalized())) {
            return EXACT_MATCH_SCORE;
        }
        int partial = 0;
        for (MatchRule rule : PARTIAL_RULES) {
            if (rule.firesFor(query, aliases)) {
                partial += rule.points();
            }
        }
        return Math.min(partial, PARTIAL_MATCH_CEILING);
    }

    static boolean phoneMatches(AliasQuery query, String participantId) {
        if (query.phoneDigits() == null || participantId == null) {
            return false;
        }
        Matcher digits = ID_DIGITS.matcher(participantId);
        return digits.find() && digits.group(1).equals(query.phoneDigits());
    }

    private static boolean anyTokenPair(AliasQuery query, String alias, BiPredicate<String, String> test) {
        for (String aliasToken : AliasQuery.tokens(alias)) {
            for (String queryToken : query.tokens()) {
                if (test.test(aliasToken, queryToken)) {
                    return true;
                }
            }
        }
        return false;
    }
}
