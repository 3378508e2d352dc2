package com.ciro.gatemux.error;

public class SessionNotFoundException extends GatemuxException {

    public SessionNotFoundException(String sessionId) {
        super("SESSION_NOT_FOUND", "no exec session " + sessionId);
    }
}
