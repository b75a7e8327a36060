package com.mcr.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link GenerativeBackend} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Works against any OpenAI-compatible endpoint configured through
 * {@code spring.ai.openai.base-url}.
 */
@Service
public class LlmService implements GenerativeBackend {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public String generate(String prompt) {
        log.debug("LLM call started ({} chars)", prompt.length());
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .user(prompt)
                .call()
                .content();
        return checked(response, start);
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return generate(userPrompt);
        }
        log.debug("LLM call started with system prompt ({} + {} chars)", systemPrompt.length(), userPrompt.length());
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        return checked(response, start);
    }

    private String checked(String response, long start) {
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content. "
                    + "Check that the model is running and reachable.");
        }
        return response;
    }
}
