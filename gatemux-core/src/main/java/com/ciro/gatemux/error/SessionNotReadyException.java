package com.ciro.gatemux.error;

public class SessionNotReadyException extends GatemuxException {

    private final String sessionId;

    public SessionNotReadyException(String sessionId, String state) {
        super("SESSION_NOT_READY", "exec session " + sessionId + " is " + state);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
