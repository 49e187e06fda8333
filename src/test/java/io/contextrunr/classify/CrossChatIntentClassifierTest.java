package io.contextrunr.classify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrossChatIntentClassifierTest {

    private final CrossChatIntentClassifier classifier = new CrossChatIntentClassifier();

    @Test
    void shouldDetectMoodQuestionAboutGroup() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("kenapa kamu marah di grup", "Qi");

        assertTrue(intent.isCrossChatQuestion());
        assertEquals(CrossChatIntent.Type.MOOD, intent.type());
        assertTrue(intent.chat().isEmpty());
    }

    @Test
    void shouldReadAgentNameAsYouAndStripTrailingTime() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("Qi, kenapa Qi kesal di grup kantor tadi?", "Qi");

        assertEquals(CrossChatIntent.Type.MOOD, intent.type());
        assertEquals("kantor", intent.targetChat());
    }

    @Test
    void shouldDetectConversationWithPerson() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("Kamu ngobrol apa sama Budi?", "Qi");

        assertEquals(CrossChatIntent.Type.CONVERSATION, intent.type());
        assertEquals("budi", intent.targetName());
        assertEquals("talk-with-person", intent.ruleName());
    }

    @Test
    void shouldDetectEnglishConversationQuestion() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("What did you talk with Sarah about?", "Qi");

        assertEquals(CrossChatIntent.Type.CONVERSATION, intent.type());
        assertEquals("sarah", intent.targetName());
    }

    @Test
    void shouldDetectHonorificNameFirst() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("Pak Budi tadi ngomong apa", "Qi");

        assertEquals(CrossChatIntent.Type.CONVERSATION, intent.type());
        assertEquals("budi", intent.targetName());
    }

    @Test
    void shouldFallBackToNameFirstRule() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("budi bilang apa?", "Qi");

        assertEquals(CrossChatIntent.Type.CONVERSATION, intent.type());
        assertEquals("budi", intent.targetName());
        assertEquals("name-first", intent.ruleName());
    }

    @Test
    void shouldDetectGroupActivity() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("Apa yang terjadi di grup kantor?", "Qi");

        assertEquals(CrossChatIntent.Type.GROUP_ACTIVITY, intent.type());
        assertEquals("kantor", intent.targetChat());
    }

    @Test
    void shouldDetectGroupTopicQuestion() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent("grup alumni lagi ngomongin apa", "Qi");

        assertEquals(CrossChatIntent.Type.GROUP_ACTIVITY, intent.type());
        assertEquals("alumni", intent.targetChat());
    }

    @Test
    void shouldKeepTypeWhenTargetIsStopword() {
        CrossChatIntent pronoun = classifier.classifyCrossChatIntent("kamu ngobrol sama dia?", "Qi");
        assertTrue(pronoun.isCrossChatQuestion());
        assertEquals(CrossChatIntent.Type.CONVERSATION, pronoun.type());
        assertNull(pronoun.targetName());

        CrossChatIntent self = classifier.classifyCrossChatIntent("kamu ngobrol sama Qi?", "Qi");
        assertNull(self.targetName());
    }

    @Test
    void shouldIgnoreOrdinaryMessages() {
        assertFalse(classifier.classifyCrossChatIntent("halo apa kabar", "Qi").isCrossChatQuestion());
        assertFalse(classifier.classifyCrossChatIntent("kenapa kamu marah?", "Qi").isCrossChatQuestion());
        assertEquals(CrossChatIntent.none(), classifier.classifyCrossChatIntent(null, "Qi"));
        assertEquals(CrossChatIntent.none(), classifier.classifyCrossChatIntent("  ", "Qi"));
    }

    @Test
    void shouldPreferMoodOverConversationRules() {
        CrossChatIntent intent = classifier.classifyCrossChatIntent(
                "kenapa kamu marah sama budi di grup kantor", "Qi");
        assertEquals(CrossChatIntent.Type.MOOD, intent.type());
    }
}
