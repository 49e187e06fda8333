package io.contextrunr.channel;

import io.contextrunr.alias.AliasCandidate;
import io.contextrunr.alias.AliasDirectory;
import io.contextrunr.classify.TopicTag;
import io.contextrunr.context.IntroductionPolicy;
import io.contextrunr.context.RelevanceAssembler;
import io.contextrunr.core.ContextEntry;
import io.contextrunr.core.ContextWindow;
import io.contextrunr.core.Message;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ContextController.class)
@AutoConfigureMockMvc(addFilters = false)
class ContextControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationRecorder recorder;

    @MockBean
    private MessageCanonicalizer canonicalizer;

    @MockBean
    private RelevanceAssembler assembler;

    @MockBean
    private AliasDirectory aliasDirectory;

    @MockBean
    private IntroductionPolicy introductionPolicy;

    @Test
    void shouldReturnHealthStatus() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("contextrunr"));
    }

    @Test
    void shouldRecordMessage() throws Exception {
        Message recorded = new Message("m1", "kantor@g.us", "U1", "Budi", "mau makan dimana?", NOW,
                Message.Role.USER, Set.of(TopicTag.FOOD, TopicTag.QUESTION), false, null, false);
        when(recorder.record(eq("kantor@g.us"), any(InboundMessage.class))).thenReturn(recorded);

        mockMvc.perform(post("/api/conversations/kantor@g.us/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "id": "m1",
                                    "senderId": "U1",
                                    "senderName": "Budi",
                                    "text": "mau makan dimana?",
                                    "chatName": "Kantor Pusat"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("m1"))
                .andExpect(jsonPath("$.role").value("user"))
                .andExpect(jsonPath("$.topics[0]").value(TopicTag.FOOD.label()))
                .andExpect(jsonPath("$.topics.length()").value(2));
    }

    @Test
    void shouldBuildContextWithoutRecordingQuery() throws Exception {
        Message query = Message.user("q1", "kantor@g.us", "U1", "Budi", "kamu ngobrol apa sama Sarah?", NOW);
        when(canonicalizer.canonicalize(eq("kantor@g.us"), any(InboundMessage.class))).thenReturn(query);
        when(assembler.buildContext(query, "kantor@g.us")).thenReturn(new ContextWindow(List.of(
                ContextEntry.system("This is the group chat \"Kantor\" with 3 members.", "chat-header",
                        ContextEntry.PRIORITY_CHAT_HEADER, NOW),
                ContextEntry.fromMessage(Message.user("m1", "kantor@g.us", "U2", "Sarah", "halo", NOW))),
                List.of("facts")));

        mockMvc.perform(post("/api/conversations/kantor@g.us/context")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"senderId": "U1", "text": "kamu ngobrol apa sama Sarah?"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.length()").value(2))
                .andExpect(jsonPath("$.entries[0].role").value("system"))
                .andExpect(jsonPath("$.entries[0].source").value("chat-header"))
                .andExpect(jsonPath("$.entries[1].content").value("Sarah: halo"))
                .andExpect(jsonPath("$.entries[1].messageId").value("m1"))
                .andExpect(jsonPath("$.degradedSteps[0]").value("facts"));

        verify(recorder, never()).record(anyString(), any());
    }

    @Test
    void shouldRejectMalformedPayload() throws Exception {
        when(recorder.record(eq("kantor@g.us"), any(InboundMessage.class)))
                .thenThrow(new IllegalArgumentException("senderId is required"));

        mockMvc.perform(post("/api/conversations/kantor@g.us/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text": "halo"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("senderId is required"));
    }

    @Test
    void shouldClearConversation() throws Exception {
        when(recorder.clear("kantor@g.us")).thenReturn(true);

        mockMvc.perform(delete("/api/conversations/kantor@g.us/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("kantor@g.us"))
                .andExpect(jsonPath("$.cleared").value(true));
    }

    @Test
    void shouldReturnNotFoundWhenClearingUnknownConversation() throws Exception {
        when(recorder.clear("nobody@g.us")).thenReturn(false);

        mockMvc.perform(delete("/api/conversations/nobody@g.us/messages"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldResolveAliases() throws Exception {
        when(aliasDirectory.resolveCandidates("budi")).thenReturn(List.of(
                new AliasCandidate("U1", "Budi", 10),
                new AliasCandidate("U2", "Budiman", 7)));

        mockMvc.perform(get("/api/aliases").param("name", "budi"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].participantId").value("U1"))
                .andExpect(jsonPath("$[0].score").value(10))
                .andExpect(jsonPath("$[1].displayName").value("Budiman"));
    }

    @Test
    void shouldDescribeIntroduction() throws Exception {
        when(introductionPolicy.shouldIntroduce("kantor@g.us")).thenReturn(true);
        when(introductionPolicy.introductionText("kantor@g.us")).thenReturn("Hi everyone! I'm Qi.");

        mockMvc.perform(get("/api/conversations/kantor@g.us/introduction"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shouldIntroduce").value(true))
                .andExpect(jsonPath("$.text").value("Hi everyone! I'm Qi."));

        mockMvc.perform(post("/api/conversations/kantor@g.us/introduction"))
                .andExpect(status().isNoContent());
        verify(introductionPolicy).markIntroduced("kantor@g.us");
    }
}
