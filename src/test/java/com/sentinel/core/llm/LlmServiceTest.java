package com.sentinel.core.llm;

import com.sentinel.core.tier.RepairPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        llmService = new LlmService(mockChatClient, "local");
    }

    private void respond(String text, int promptTokens, int completionTokens) {
        var metadata = ChatResponseMetadata.builder()
                .usage(new DefaultUsage(promptTokens, completionTokens))
                .build();
        when(mockCallResponse.chatResponse())
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(text))), metadata));
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and returns value with token usage")
    void structuredCall() {
        respond("""
                {"summary":"fix off-by-one","edits":[{"path":"src/A.java","content":"class A {}"}]}
                """, 1200, 300);

        StructuredResponse<RepairPlan> response =
                llmService.structuredCall("System prompt", "User prompt", RepairPlan.class);

        verify(mockRequestSpec).system("System prompt");
        assertEquals("fix off-by-one", response.value().summary());
        assertEquals("src/A.java", response.value().edits().get(0).path());
        assertEquals(1200, response.promptTokens());
        assertEquals(300, response.completionTokens());
    }

    @Test
    @DisplayName("Blank content raises LlmEmptyResponseException")
    void emptyContent() {
        respond("  ", 10, 0);
        var e = assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", RepairPlan.class));
        assertEquals("local", e.tier());
    }

    @Test
    @DisplayName("Unparseable content raises LlmParseException")
    void garbage() {
        respond("I could not find a fix, sorry.", 10, 10);
        var e = assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", RepairPlan.class));
        assertEquals("RepairPlan", e.outputType());
        assertTrue(e.getMessage().startsWith("[local]"));
    }

    @Test
    @DisplayName("Jackson fallback strips markdown fences and ignores unknown fields")
    void jacksonFallback() {
        RepairPlan plan = llmService.parseWithJackson("""
                ```json
                {"summary":"ok","edits":[],"confidence":0.9}
                ```
                """, RepairPlan.class);
        assertEquals("ok", plan.summary());
        assertTrue(plan.edits().isEmpty());
    }
}
