package com.mcr.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while handling a request, printed by the CLI in verbose mode.
 *
 * @param eventType  e.g. "session.created", "assert.completed", "query.completed", "refinement.failed"
 * @param sessionId  the session the request ran against
 * @param strategyId the strategy that ran (nullable for session-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record McrEvent(
    String eventType,
    String sessionId,
    String strategyId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static McrEvent of(String eventType, String sessionId, String strategyId, Map<String, Object> payload) {
        return new McrEvent(eventType, sessionId, strategyId, payload == null ? Map.of() : payload, Instant.now());
    }
}
