package com.mcr.core.error;

public class SessionNotFoundException extends McrException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorCategory.NOT_FOUND, "SESSION_NOT_FOUND", "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
