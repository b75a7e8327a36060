package com.mcr.core.session;

import java.util.Collection;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed session storage. Implementations serialise concurrent updates to the
 * same session id.
 */
public interface SessionStore {

    /** Stores the context unless one with the same id exists; returns the stored one. */
    SessionContext create(SessionContext context);

    Optional<SessionContext> find(String sessionId);

    /**
     * Atomically replaces the session with {@code update.apply(current)}.
     *
     * @throws com.mcr.core.error.SessionNotFoundException when the id is unknown
     */
    SessionContext update(String sessionId, UnaryOperator<SessionContext> update);

    boolean delete(String sessionId);

    Collection<String> ids();
}
