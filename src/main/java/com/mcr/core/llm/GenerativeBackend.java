package com.mcr.core.llm;

/**
 * Free-text generation backend. No structural contract on the output beyond "text".
 */
public interface GenerativeBackend {

    String generate(String prompt);

    default String generate(String systemPrompt, String userPrompt) {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return generate(userPrompt);
        }
        return generate(systemPrompt + "\n\n" + userPrompt);
    }
}
