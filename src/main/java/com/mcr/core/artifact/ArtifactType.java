package com.mcr.core.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.mcr.core.reasoner.ReasonerResult;

import java.util.List;

/**
 * Closed set of artifact types. Each type fixes the Java class its content must have.
 */
public enum ArtifactType {
    NL_TEXT(String.class),
    SIR_JSON(JsonNode.class),
    FORMAL_CLAUSE(String.class),
    FORMAL_KB(List.class),
    FORMAL_QUERY(String.class),
    QUERY_RESULT(ReasonerResult.class),
    CRITIQUE_RESULT(CritiqueResult.class),
    UNTYPED(Object.class);

    private final Class<?> contentType;

    ArtifactType(Class<?> contentType) {
        this.contentType = contentType;
    }

    public Class<?> contentType() {
        return contentType;
    }

    public boolean accepts(Object content) {
        if (content == null) {
            return false;
        }
        if (!contentType.isInstance(content)) {
            return false;
        }
        if (this == FORMAL_KB) {
            return ((List<?>) content).stream().allMatch(String.class::isInstance);
        }
        return true;
    }
}
