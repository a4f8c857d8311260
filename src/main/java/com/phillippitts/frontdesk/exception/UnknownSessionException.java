package com.phillippitts.frontdesk.exception;

/**
 * Thrown by lookups that require a live session when none exists for the id.
 */
public class UnknownSessionException extends FrontDeskException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("No active session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
