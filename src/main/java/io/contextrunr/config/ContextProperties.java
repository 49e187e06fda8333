package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Limits and thresholds for context assembly.
 *
 * <p>Binds to {@code context} in application.yml:</p>
 * <pre>
 * context:
 *   max-context-messages: ${MAX_CONTEXT_MESSAGES:100}
 *   max-relevant-messages: ${MAX_RELEVANT_MESSAGES:20}
 *   max-cross-chat-messages: ${MAX_CROSS_CHAT_MESSAGES:8}
 *   max-topic-specific-messages: ${MAX_TOPIC_SPECIFIC_MESSAGES:10}
 *   fact-confidence-threshold: ${FACT_CONFIDENCE_THRESHOLD:0.75}
 *   thread-top-k: ${THREAD_TOP_K:2}
 * </pre>
 *
 * @param maxContextMessages          messages retained per conversation
 * @param maxRelevantMessages         conversation entries in a context window
 * @param maxCrossChatMessages        lines in a cross-chat excerpt block
 * @param maxTopicSpecificMessages    topic-matched messages considered per query (half per tag)
 * @param maxImageAnalysisMessages    image analyses considered for an image follow-up
 * @param factConfidenceThreshold     minimum fact confidence included in a window
 * @param threadTopK                  threads surfaced per group conversation
 * @param minAliasScore               minimum alias score for a candidate
 * @param privateCrossContextEnabled  whether group windows include private-chat excerpts
 * @param imageLookupWindow           how far back image similarity lookups search
 * @param imageSimilarityThreshold    minimum similarity for an image match
 */
@ConfigurationProperties(prefix = "context")
public record ContextProperties(
        Integer maxContextMessages,
        Integer maxRelevantMessages,
        Integer maxCrossChatMessages,
        Integer maxTopicSpecificMessages,
        Integer maxImageAnalysisMessages,
        Double factConfidenceThreshold,
        Integer threadTopK,
        Integer minAliasScore,
        Boolean privateCrossContextEnabled,
        Duration imageLookupWindow,
        Double imageSimilarityThreshold
) {
    public ContextProperties {
        if (maxContextMessages == null || maxContextMessages <= 0) {
            maxContextMessages = 100;
        }
        if (maxRelevantMessages == null || maxRelevantMessages <= 0) {
            maxRelevantMessages = 20;
        }
        if (maxCrossChatMessages == null || maxCrossChatMessages < 0) {
            maxCrossChatMessages = 8;
        }
        if (maxTopicSpecificMessages == null || maxTopicSpecificMessages < 0) {
            maxTopicSpecificMessages = 10;
        }
        if (maxImageAnalysisMessages == null || maxImageAnalysisMessages < 0) {
            maxImageAnalysisMessages = 3;
        }
        if (factConfidenceThreshold == null || factConfidenceThreshold < 0 || factConfidenceThreshold > 1) {
            factConfidenceThreshold = 0.75;
        }
        if (threadTopK == null || threadTopK <= 0) {
            threadTopK = 2;
        }
        if (minAliasScore == null || minAliasScore < 0) {
            minAliasScore = 2;
        }
        if (privateCrossContextEnabled == null) {
            privateCrossContextEnabled = true;
        }
        if (imageLookupWindow == null || imageLookupWindow.isNegative() || imageLookupWindow.isZero()) {
            imageLookupWindow = Duration.ofDays(7);
        }
        if (imageSimilarityThreshold == null || imageSimilarityThreshold < 0 || imageSimilarityThreshold > 1) {
            imageSimilarityThreshold = 0.5;
        }
    }

    /** All defaults. */
    public static ContextProperties defaults() {
        return new ContextProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public ContextProperties withMaxRelevantMessages(int value) {
        return new ContextProperties(maxContextMessages, value, maxCrossChatMessages, maxTopicSpecificMessages,
                maxImageAnalysisMessages, factConfidenceThreshold, threadTopK, minAliasScore,
                privateCrossContextEnabled, imageLookupWindow, imageSimilarityThreshold);
    }

    public ContextProperties withPrivateCrossContext(boolean enabled) {
        return new ContextProperties(maxContextMessages, maxRelevantMessages, maxCrossChatMessages,
                maxTopicSpecificMessages, maxImageAnalysisMessages, factConfidenceThreshold, threadTopK,
                minAliasScore, enabled, imageLookupWindow, imageSimilarityThreshold);
    }

    /** Topic-matched messages pulled per topic tag. */
    public int topicMessagesPerTag() {
        return maxTopicSpecificMessages / 2;
    }
}
