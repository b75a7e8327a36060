package com.mcr.core.session;

import com.mcr.core.error.SessionNotFoundException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, SessionContext> sessions = new ConcurrentHashMap<>();

    @Override
    public SessionContext create(SessionContext context) {
        return sessions.computeIfAbsent(context.id(), k -> context);
    }

    @Override
    public Optional<SessionContext> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public SessionContext update(String sessionId, UnaryOperator<SessionContext> update) {
        SessionContext updated = sessions.computeIfPresent(sessionId, (k, current) -> update.apply(current));
        if (updated == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return updated;
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public Collection<String> ids() {
        return List.copyOf(sessions.keySet());
    }
}
