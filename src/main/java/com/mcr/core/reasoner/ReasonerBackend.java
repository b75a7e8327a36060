package com.mcr.core.reasoner;

/**
 * Symbolic query backend. Knowledge bases and queries are plain formal-language
 * strings; a syntactically valid query with no solutions yields an empty result.
 */
public interface ReasonerBackend {

    ReasonerResult query(String knowledgeBase, String query);

    ValidationResult validate(String knowledgeBase);

    default ValidationResult validateQuery(String query) {
        return validate(query);
    }
}
