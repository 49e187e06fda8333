package io.contextrunr.classify;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TopicClassifierTest {

    private final TopicClassifier classifier = new TopicClassifier();

    @Test
    void shouldTagIdentityQuestion() {
        Set<TopicTag> tags = classifier.classifyTopics("Siapa nama kamu?");
        assertTrue(tags.contains(TopicTag.IDENTITY));
        assertTrue(tags.contains(TopicTag.QUESTION));
        assertFalse(tags.contains(TopicTag.FOOD));
    }

    @Test
    void shouldAssignSeveralTags() {
        Set<TopicTag> tags = classifier.classifyTopics("Halo! Aku suka nonton film sambil makan");
        assertTrue(tags.containsAll(Set.of(TopicTag.GREETING, TopicTag.INTERESTS, TopicTag.ENTERTAINMENT, TopicTag.FOOD)));
    }

    @Test
    void shouldTagImagesAndRequests() {
        Set<TopicTag> tags = classifier.classifyTopics("Tolong lihat foto ini");
        assertTrue(tags.contains(TopicTag.IMAGE));
        assertTrue(tags.contains(TopicTag.REQUEST));
    }

    @Test
    void shouldNotMatchInsideOtherWords() {
        // "hi" inside "nothing", "apa" inside "kapal"
        Set<TopicTag> tags = classifier.classifyTopics("nothing about the kapal");
        assertFalse(tags.contains(TopicTag.GREETING));
        assertFalse(tags.contains(TopicTag.QUESTION));
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertTrue(classifier.classifyTopics(null).isEmpty());
        assertTrue(classifier.classifyTopics("   ").isEmpty());
    }

    @Test
    void shouldCoverEveryRuleWithItsOwnTag() {
        for (TopicClassifier.TopicRule rule : TopicClassifier.RULES) {
            assertNotNull(rule.tag());
        }
        assertEquals(TopicTag.values().length, TopicClassifier.RULES.stream().map(TopicClassifier.TopicRule::tag).distinct().count());
    }
}
