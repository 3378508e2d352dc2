package com.ciro.gatemux.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/** Evento no solicitado. {@code seq} es opcional (null si el peer no lo manda). */
public record EventFrame(String topic, JsonNode payload, Long seq) implements Frame {

    public EventFrame {
        Objects.requireNonNull(topic, "topic");
        if (payload == null) payload = NullNode.getInstance();
    }

    public EventFrame(String topic, JsonNode payload) {
        this(topic, payload, null);
    }

    @Override
    public String type() {
        return TYPE_EVENT;
    }
}
