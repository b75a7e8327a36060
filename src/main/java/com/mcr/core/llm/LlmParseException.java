package com.mcr.core.llm;

import com.mcr.core.error.ErrorCategory;
import com.mcr.core.error.McrException;

/**
 * Thrown when LLM output cannot be parsed into the expected structure.
 */
public class LlmParseException extends McrException {

    public LlmParseException(String message) {
        super(ErrorCategory.VALIDATION, "LLM_PARSE_ERROR", message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, "LLM_PARSE_ERROR", message, cause);
    }
}
