package io.contextrunr.context;

import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.Conversation;
import io.contextrunr.core.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Attaches the analysis of a previously shared image when a message refers back to it.
 *
 * <p>The best match of the optional {@link ImageSimilarityLookup} is used when it maps to an
 * image analysis of the same conversation; otherwise the most recent analysis is used.</p>
 */
@Component
public class ImageContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ImageContextBuilder.class);
    static final String SOURCE = "image";

    private final ImageReferenceDetector detector;
    private final Optional<ImageSimilarityLookup> similarityLookup;
    private final ContextProperties properties;

    public ImageContextBuilder(ImageReferenceDetector detector, Optional<ImageSimilarityLookup> similarityLookup,
                               ContextProperties properties) {
        this.detector = detector;
        this.similarityLookup = similarityLookup;
        this.properties = properties;
    }

    /**
     * Builds the image context entry for a query.
     *
     * @return the entry, or empty when the conversation has no image analysis or the query
     *         does not refer to an image
     */
    public Optional<ContextEntry> build(Message query, Conversation conversation, Instant now) {
        List<Message> messages = conversation.getMessages();
        List<Message> analyses = recentAnalyses(messages, properties.maxImageAnalysisMessages());
        if (analyses.isEmpty() || !detector.isImageReference(query.content())) {
            return Optional.empty();
        }

        Message chosen = bestMatch(query, conversation.getId(), messages, now).orElse(analyses.get(0));
        log.debug("Image reference in {}: using analysis {}", conversation.getId(), chosen.id());

        StringJoiner content = new StringJoiner("\n");
        content.add("Earlier, %s shared an image (%s) and it was analysed as: %s".formatted(
                imageSender(messages, chosen), describeAge(chosen.timestamp(), now), chosen.imageAnalysisText()));

        List<String> others = new ArrayList<>();
        for (Message analysis : analyses) {
            if (!analysis.id().equals(chosen.id())) {
                others.add(analysis.imageAnalysisText());
            }
        }
        if (!others.isEmpty()) {
            content.add("Other images shared before: " + String.join(" | ", others));
        }

        return Optional.of(ContextEntry.system(content.toString(), SOURCE, ContextEntry.PRIORITY_IMAGE, now));
    }

    /** Image analyses, most recent first, at most {@code limit}. */
    static List<Message> recentAnalyses(List<Message> messages, int limit) {
        List<Message> analyses = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0 && analyses.size() < limit; i--) {
            if (messages.get(i).isImageAnalysis()) {
                analyses.add(messages.get(i));
            }
        }
        return analyses;
    }

    private Optional<Message> bestMatch(Message query, String conversationId, List<Message> messages, Instant now) {
        if (similarityLookup.isEmpty()) {
            return Optional.empty();
        }
        ImageQuery imageQuery = new ImageQuery(conversationId, now.minus(properties.imageLookupWindow()),
                properties.maxImageAnalysisMessages(), properties.imageSimilarityThreshold());
        List<ImageMatch> matches = similarityLookup.get().findSimilar(query.content(), imageQuery);

        Map<String, Message> analysesById = new LinkedHashMap<>();
        messages.stream().filter(Message::isImageAnalysis).forEach(m -> analysesById.put(m.id(), m));

        return matches.stream()
                .filter(match -> match.similarityScore() >= imageQuery.threshold())
                .filter(match -> analysesById.containsKey(match.id()))
                .max(Comparator.comparingDouble(ImageMatch::similarityScore))
                .map(match -> analysesById.get(match.id()));
    }

    /** Sender of the image: the user message the analysis answers, else the nearest earlier user message. */
    private static String imageSender(List<Message> messages, Message analysis) {
        int index = -1;
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (analysis.repliedToId() != null && message.id().equals(analysis.repliedToId())) {
                return message.senderLabel();
            }
            if (message.id().equals(analysis.id())) {
                index = i;
            }
        }
        for (int i = index - 1; i >= 0; i--) {
            if (messages.get(i).role() == Message.Role.USER) {
                return messages.get(i).senderLabel();
            }
        }
        return "someone";
    }

    static String describeAge(Instant then, Instant now) {
        Duration age = Duration.between(then, now);
        if (age.isNegative() || age.toMinutes() < 1) {
            return "just now";
        }
        if (age.toMinutes() < 60) {
            return age.toMinutes() + " minutes ago";
        }
        if (age.toHours() < 24) {
            return age.toHours() + " hours ago";
        }
        return age.toDays() + " days ago";
    }
}
