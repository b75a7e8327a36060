package com.mcr.core.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.mcr.core.artifact.ArtifactType;

import java.io.Serializable;
import java.util.Map;

/**
 * What a step does. The set of kinds is closed; an unknown {@code kind} in a
 * strategy file is rejected when the file is read.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StepAction.Generative.class, name = "generative"),
        @JsonSubTypes.Type(value = StepAction.Transform.class, name = "transform"),
        @JsonSubTypes.Type(value = StepAction.ReasonerQuery.class, name = "reasoner_query"),
        @JsonSubTypes.Type(value = StepAction.Compare.class, name = "compare")
})
public sealed interface StepAction extends Serializable
        permits StepAction.Generative, StepAction.Transform, StepAction.ReasonerQuery, StepAction.Compare {

    @JsonIgnore
    StepKind kind();

    /**
     * Fills a named prompt template with the run's artifacts and wraps the
     * generated text as {@code targetType}.
     */
    record Generative(String template, ArtifactType targetType) implements StepAction {
        public Generative {
            targetType = targetType == null ? ArtifactType.NL_TEXT : targetType;
        }

        @Override
        public StepKind kind() {
            return StepKind.GENERATIVE;
        }
    }

    /** Runs a registered deterministic transform. */
    record Transform(String transform, Map<String, String> params) implements StepAction {
        public Transform {
            params = params == null ? Map.of() : Map.copyOf(params);
        }

        @Override
        public StepKind kind() {
            return StepKind.TRANSFORM;
        }
    }

    /**
     * Runs a query against a knowledge base. Each field names an input of the
     * step; at least one of {@code knowledgeBaseInput} and {@code sessionInput}
     * must be set.
     */
    record ReasonerQuery(String queryInput, String knowledgeBaseInput, String sessionInput) implements StepAction {
        @Override
        public StepKind kind() {
            return StepKind.REASONER_QUERY;
        }
    }

    /** Compares exactly two inputs; {@code method} is exact, embedding or llm. */
    record Compare(String method, Double threshold) implements StepAction {
        public static final double DEFAULT_THRESHOLD = 0.8;

        public Compare {
            method = method == null ? "exact" : method;
            threshold = threshold == null ? DEFAULT_THRESHOLD : threshold;
        }

        @Override
        public StepKind kind() {
            return StepKind.COMPARE;
        }
    }
}
