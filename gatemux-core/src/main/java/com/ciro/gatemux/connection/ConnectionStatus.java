package com.ciro.gatemux.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Foto del estado de la conexión, para mostrar en la UI.
 */
public record ConnectionStatus(
        ConnectionState state,
        String url,
        int reconnectAttempt,
        long lastDelayMs,
        String lastError,
        Instant openedAt,
        int pendingCalls
) {
    public boolean connected() {
        return state == ConnectionState.OPEN;
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode n = mapper.createObjectNode();
        n.put("state", state.label());
        n.put("connected", connected());
        n.put("url", url);
        n.put("reconnectAttempt", reconnectAttempt);
        n.put("lastDelayMs", lastDelayMs);
        if (lastError != null) n.put("lastError", lastError); else n.putNull("lastError");
        if (openedAt != null) n.put("openedAt", openedAt.toString()); else n.putNull("openedAt");
        n.put("pendingCalls", pendingCalls);
        return n;
    }
}
