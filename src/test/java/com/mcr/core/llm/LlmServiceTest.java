package com.mcr.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
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

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("generate sends system and user prompts to ChatClient")
    void sendsBothPrompts() {
        when(mockCallResponse.content()).thenReturn("father(tom, bob).");

        String reply = llmService.generate("System prompt", "User prompt");

        assertEquals("father(tom, bob).", reply);
        verify(mockRequestSpec).system("System prompt");
        verify(mockRequestSpec).user("User prompt");
    }

    @Test
    @DisplayName("a blank system prompt sends the user prompt alone")
    void blankSystemPrompt() {
        when(mockCallResponse.content()).thenReturn("ok");

        llmService.generate("  ", "User prompt");

        verify(mockRequestSpec, never()).system(anyString());
        verify(mockRequestSpec).user("User prompt");
    }

    @Test
    @DisplayName("empty content raises LlmEmptyResponseException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn(null).thenReturn("   ");

        assertThrows(LlmEmptyResponseException.class, () -> llmService.generate("prompt"));
        var e = assertThrows(LlmEmptyResponseException.class, () -> llmService.generate("sys", "user"));
        assertTrue(e.isRetryable());
    }

    @Test
    @DisplayName("model id combines provider and model")
    void modelId() {
        var props = new LlmProperties();
        assertEquals("openai", props.modelId());

        props.setProvider("ollama");
        props.setModel("llama3");
        assertEquals("ollama:llama3", props.modelId());
    }
}
