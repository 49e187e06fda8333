package io.contextrunr.channel;

import io.contextrunr.alias.AliasCandidate;
import io.contextrunr.alias.AliasDirectory;
import io.contextrunr.classify.TopicTag;
import io.contextrunr.context.IntroductionPolicy;
import io.contextrunr.context.RelevanceAssembler;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.ContextWindow;
import io.contextrunr.core.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for recording messages and building context windows.
 */
@RestController
@RequestMapping("/api")
public class ContextController {

    private static final Logger log = LoggerFactory.getLogger(ContextController.class);

    private final ConversationRecorder recorder;
    private final MessageCanonicalizer canonicalizer;
    private final RelevanceAssembler assembler;
    private final AliasDirectory aliasDirectory;
    private final IntroductionPolicy introductionPolicy;

    public ContextController(ConversationRecorder recorder, MessageCanonicalizer canonicalizer,
                             RelevanceAssembler assembler, AliasDirectory aliasDirectory,
                             IntroductionPolicy introductionPolicy) {
        this.recorder = recorder;
        this.canonicalizer = canonicalizer;
        this.assembler = assembler;
        this.aliasDirectory = aliasDirectory;
        this.introductionPolicy = introductionPolicy;
    }

    /**
     * Records a message in a conversation.
     */
    @PostMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<RecordedMessageDto> recordMessage(@PathVariable String conversationId,
                                                            @RequestBody MessageRequestDto request) {
        Message message = recorder.record(conversationId, request.toInbound());
        return ResponseEntity.ok(RecordedMessageDto.from(message));
    }

    /**
     * Builds the context window for a query message. The query itself is not recorded.
     */
    @PostMapping("/conversations/{conversationId}/context")
    public ResponseEntity<ContextWindowDto> buildContext(@PathVariable String conversationId,
                                                         @RequestBody MessageRequestDto request) {
        Message query = canonicalizer.canonicalize(conversationId, request.toInbound());
        ContextWindow window = assembler.buildContext(query, query.conversationId());
        return ResponseEntity.ok(ContextWindowDto.from(window));
    }

    /**
     * Clears a conversation's messages, keeping its participants.
     */
    @DeleteMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<Map<String, Object>> clearMessages(@PathVariable String conversationId) {
        if (!recorder.clear(conversationId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("conversationId", conversationId, "cleared", true));
    }

    /**
     * Whether the agent should introduce itself, with the introduction text.
     */
    @GetMapping("/conversations/{conversationId}/introduction")
    public ResponseEntity<IntroductionDto> introduction(@PathVariable String conversationId) {
        boolean shouldIntroduce = introductionPolicy.shouldIntroduce(conversationId);
        String text = shouldIntroduce ? introductionPolicy.introductionText(conversationId) : null;
        return ResponseEntity.ok(new IntroductionDto(shouldIntroduce, text));
    }

    @PostMapping("/conversations/{conversationId}/introduction")
    public ResponseEntity<Void> markIntroduced(@PathVariable String conversationId) {
        introductionPolicy.markIntroduced(conversationId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Resolves a name to participants.
     */
    @GetMapping("/aliases")
    public ResponseEntity<List<AliasCandidate>> resolveAliases(@RequestParam("name") String name) {
        return ResponseEntity.ok(aliasDirectory.resolveCandidates(name));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "service", "contextrunr"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    // --- DTOs ---

    public record MessageRequestDto(
            String id,
            String senderId,
            String senderName,
            String text,
            Instant timestamp,
            String quotedMessageId,
            Boolean hasImage,
            String chatName
    ) {
        InboundMessage toInbound() {
            return new InboundMessage(id, senderId, senderName, text, timestamp, quotedMessageId,
                    Boolean.TRUE.equals(hasImage), chatName);
        }
    }

    public record RecordedMessageDto(String id, String conversationId, String senderName, String role,
                                     List<String> topics, Instant timestamp) {
        static RecordedMessageDto from(Message message) {
            return new RecordedMessageDto(message.id(), message.conversationId(), message.senderName(),
                    message.role().name().toLowerCase(),
                    message.topics().stream().map(TopicTag::label).sorted().toList(),
                    message.timestamp());
        }
    }

    public record ContextEntryDto(String role, String content, String source, int priority, String messageId) {
        static ContextEntryDto from(ContextEntry entry) {
            return new ContextEntryDto(entry.role().name().toLowerCase(), entry.content(), entry.sourceLabel(),
                    entry.priority(), entry.messageId());
        }
    }

    public record ContextWindowDto(List<ContextEntryDto> entries, List<String> degradedSteps) {
        static ContextWindowDto from(ContextWindow window) {
            return new ContextWindowDto(window.entries().stream().map(ContextEntryDto::from).toList(),
                    window.degradedSteps());
        }
    }

    public record IntroductionDto(boolean shouldIntroduce, String text) {}
}
