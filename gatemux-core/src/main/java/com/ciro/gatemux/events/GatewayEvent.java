package com.ciro.gatemux.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * Evento entregado por el fan-out.
 *
 * @param topic   clave de ruteo con la que se publicó
 * @param name    nombre original del evento (del gateway o local, p.ej. {@code exec.closed})
 * @param payload cuerpo JSON
 * @param seq     secuencia del gateway si vino, si no null
 */
public record GatewayEvent(String topic, String name, JsonNode payload, Long seq) {

    public GatewayEvent {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(name, "name");
        if (payload == null) payload = NullNode.getInstance();
    }

    public GatewayEvent(String topic, String name, JsonNode payload) {
        this(topic, name, payload, null);
    }

    /** Mismo evento, otra clave de ruteo. */
    public GatewayEvent retarget(String newTopic) {
        return new GatewayEvent(newTopic, name, payload, seq);
    }
}
