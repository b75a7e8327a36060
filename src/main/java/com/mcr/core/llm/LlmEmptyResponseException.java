package com.mcr.core.llm;

import com.mcr.core.error.BackendException;

/**
 * Thrown when the LLM returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends BackendException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
