package com.mcr.core.artifact;

import com.mcr.core.error.InvalidOutputShapeException;
import com.mcr.core.reasoner.ReasonerResult;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, typed unit of data flowing through a strategy graph.
 * <p>
 * The content class is checked against {@link ArtifactType#contentType()} at
 * construction. Clause lists are copied.
 */
public record Artifact(
    String id,
    ArtifactType type,
    Object content,
    Map<String, String> metadata,
    Instant createdAt
) implements Serializable {

    public Artifact {
        Objects.requireNonNull(type, "type");
        if (!type.accepts(content)) {
            throw new InvalidOutputShapeException("Content of type "
                    + (content == null ? "null" : content.getClass().getSimpleName())
                    + " does not fit artifact type " + type);
        }
        if (type == ArtifactType.FORMAL_KB) {
            content = List.copyOf((List<?>) content);
        }
        id = id == null ? UUID.randomUUID().toString() : id;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Artifact of(ArtifactType type, Object content) {
        return new Artifact(null, type, content, Map.of(), null);
    }

    public static Artifact of(ArtifactType type, Object content, Map<String, String> metadata) {
        return new Artifact(null, type, content, metadata, null);
    }

    public static Artifact text(String text) {
        return of(ArtifactType.NL_TEXT, text);
    }

    @SuppressWarnings("unchecked")
    public <T> T contentAs(Class<T> cls) {
        if (!cls.isInstance(content)) {
            throw new InvalidOutputShapeException("Artifact " + id + " of type " + type
                    + " does not hold " + cls.getSimpleName());
        }
        return (T) content;
    }

    @SuppressWarnings("unchecked")
    public List<String> clauses() {
        if (type != ArtifactType.FORMAL_KB) {
            throw new InvalidOutputShapeException("Artifact " + id + " is " + type + ", not FORMAL_KB");
        }
        return (List<String>) content;
    }

    /**
     * Renders the content as plain text, the form in which artifacts are
     * substituted into prompt templates and handed to the reasoner.
     */
    public String asText() {
        if (content instanceof String s) {
            return s;
        }
        if (content instanceof List<?> list) {
            return String.join("\n", list.stream().map(String::valueOf).toList());
        }
        if (content instanceof ReasonerResult r) {
            return r.results().isEmpty() ? "No results" : String.join("\n", r.results());
        }
        if (content instanceof CritiqueResult c) {
            return "similarity=" + c.similarity() + ", pass=" + c.pass() + ", " + c.details();
        }
        return String.valueOf(content);
    }
}
