package io.contextrunr.context;

import io.contextrunr.memory.Fact;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FactSelectorTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final FactSelector selector = new FactSelector();

    private static Fact fact(String key, String value) {
        return new Fact("U1", key, value, 0.9, null, T0);
    }

    @Test
    void shouldExtractKeywordsWithoutStopwords() {
        assertEquals(Set.of("makanan", "favorite", "budi"), selector.keywords("Apa makanan favorite Budi? ya, apa?"));
        assertEquals(Set.of("live"), selector.keywords("Where do you live?"));
        assertTrue(selector.keywords(null).isEmpty());
    }

    @Test
    void shouldWeighKeyMatchesAboveValueMatches() {
        Set<String> keywords = Set.of("food");

        assertEquals(FactSelector.KEY_MATCH_POINTS, selector.relevance(fact("favorite_food", "bakso"), keywords));
        assertEquals(FactSelector.VALUE_MATCH_POINTS, selector.relevance(fact("hobby", "food blogging"), keywords));
        assertEquals(0, selector.relevance(fact("location", "Bandung"), keywords));
    }

    @Test
    void shouldMatchWordFragments() {
        assertEquals(FactSelector.VALUE_MATCH_POINTS,
                selector.relevance(fact("workplace", "Gojek Indonesia"), Set.of("gojeknya")));
    }

    @Test
    void shouldRankByRelevanceThenKey() {
        List<Fact> facts = List.of(fact("location", "Bandung"), fact("age", "25"), fact("workplace", "Gojek"));

        List<Fact> ranked = selector.rank(facts, selector.keywords("kerja di gojek"), 2);

        assertEquals(List.of("workplace", "age"), ranked.stream().map(Fact::key).toList());
    }

    @Test
    void shouldKeepKeyOrderWithoutKeywords() {
        List<Fact> facts = List.of(fact("location", "Bandung"), fact("age", "25"));

        assertEquals(List.of("age", "location"),
                selector.rank(facts, Set.of(), 10).stream().map(Fact::key).toList());
    }
}
