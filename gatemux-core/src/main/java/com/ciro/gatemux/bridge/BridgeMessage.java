package com.ciro.gatemux.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Mensaje hacia el navegador. En SSE es el par {@code event:}/{@code data:};
 * en WebSocket un objeto {@code {event, data}}.
 */
public record BridgeMessage(String event, JsonNode data, String id) {

    public BridgeMessage {
        Objects.requireNonNull(event, "event");
        if (data == null) data = NullNode.getInstance();
    }

    public static BridgeMessage of(String event, JsonNode data) {
        return new BridgeMessage(event, data, null);
    }

    public String dataJson(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public String toJson(ObjectMapper mapper) {
        ObjectNode n = mapper.createObjectNode();
        n.put("event", event);
        n.set("data", data);
        if (id != null) n.put("id", id);
        try {
            return mapper.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
