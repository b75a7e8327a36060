package com.mcr.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mcr.core.session.SessionContext;

import java.time.Instant;
import java.util.List;

/**
 * Outbound JSON for a session. Embedding vectors are reported as a count only.
 */
public record SessionResponse(
    @JsonProperty("session_id") String sessionId,
    long version,
    @JsonProperty("created_at") Instant createdAt,
    List<String> facts,
    List<String> lexicon,
    @JsonProperty("embedded_facts") int embeddedFacts
) {
    public static SessionResponse from(SessionContext ctx) {
        return new SessionResponse(
                ctx.id(),
                ctx.version(),
                ctx.createdAt(),
                ctx.facts(),
                List.copyOf(ctx.lexicon()),
                ctx.embeddings().size());
    }
}
